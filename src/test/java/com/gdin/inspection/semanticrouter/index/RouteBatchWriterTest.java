package com.gdin.inspection.semanticrouter.index;

import com.gdin.inspection.semanticrouter.typesense.InMemoryTypesenseClient;
import com.gdin.inspection.semanticrouter.typesense.TypesenseClient;
import com.gdin.inspection.semanticrouter.typesense.TypesenseException;
import com.gdin.inspection.semanticrouter.typesense.model.ImportResult;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RouteBatchWriterTest {

    @Mock
    private TypesenseClient typesenseClient;

    private RouteBatchWriter batchWriter;

    @BeforeEach
    void setUp() {
        batchWriter = new RouteBatchWriter(typesenseClient, new CollectionSchemaManager(typesenseClient), new RouteDocumentMapper());
    }

    @Test
    @SuppressWarnings("unchecked")
    void wholeBatchGoesInOneImport() {
        when(typesenseClient.retrieveCollection("routes")).thenReturn(InMemoryTypesenseClient.collectionResponse("routes", List.of(), 0));
        when(typesenseClient.importDocuments(eq("routes"), anyList()))
                .thenReturn(List.of(new ImportResult(true, null, null), new ImportResult(true, null, null)));

        int written = batchWriter.add("routes",
                List.of(new float[]{1, 0}, new float[]{0, 1}),
                List.of("billing", "chitchat"),
                List.of("refund please", "nice weather"),
                null, null);

        assertThat(written).isEqualTo(2);
        ArgumentCaptor<List<JsonObject>> captor = ArgumentCaptor.forClass(List.class);
        verify(typesenseClient, times(1)).importDocuments(eq("routes"), captor.capture());
        assertThat(captor.getValue()).extracting(d -> d.get("sr_route").getAsString()).containsExactly("billing", "chitchat");
    }

    @Test
    void failedImportLinesFailTheBatch() {
        when(typesenseClient.retrieveCollection("routes")).thenReturn(InMemoryTypesenseClient.collectionResponse("routes", List.of(), 0));
        when(typesenseClient.importDocuments(eq("routes"), anyList()))
                .thenReturn(List.of(new ImportResult(false, "Field `vec` must have 3 dimensions.", "{}")));

        assertThatThrownBy(() -> batchWriter.add("routes",
                List.of(new float[]{1, 0}), List.of("billing"), List.of("refund please"), null, null))
                .isInstanceOf(TypesenseException.class)
                .hasMessageContaining("must have 3 dimensions");
    }

    @Test
    void labelsThatCannotBeFilteredAreRejectedBeforeWriting() {
        assertThatThrownBy(() -> batchWriter.add("routes",
                List.of(new float[]{1, 0}), List.of("a`b"), List.of("refund please"), null, null))
                .isInstanceOf(IllegalArgumentException.class);
        verify(typesenseClient, never()).importDocuments(eq("routes"), anyList());
    }

    @Test
    void deleteByLabelUsesServerSideFilter() {
        when(typesenseClient.deleteDocuments("routes", "sr_route:=`billing`")).thenReturn(4);

        assertThat(batchWriter.deleteByLabel("routes", "billing")).isEqualTo(4);
    }
}
