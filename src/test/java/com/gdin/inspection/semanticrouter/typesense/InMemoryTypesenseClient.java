package com.gdin.inspection.semanticrouter.typesense;

import com.gdin.inspection.semanticrouter.typesense.model.ImportResult;
import com.gdin.inspection.semanticrouter.typesense.model.SearchHit;
import com.gdin.inspection.semanticrouter.typesense.model.SearchResponse;
import com.gdin.inspection.semanticrouter.util.IOUtil;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.reflect.TypeToken;
import org.typesense.model.CollectionResponse;
import org.typesense.model.CollectionSchema;
import org.typesense.model.Field;
import org.typesense.model.MultiSearchCollectionParameters;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 测试用的内存版 Typesense: 余弦距离、过滤表达式、分页、按 id upsert
 */
public class InMemoryTypesenseClient implements TypesenseClient {
    private static final Pattern VECTOR_QUERY = Pattern.compile("^(\\w+):\\(\\[(.*)], k:(\\d+)\\)$");
    private static final Pattern FILTER_ATOM = Pattern.compile("^(\\w+):(!=|=)`(.*)`$");
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    private final Gson gson = new Gson();
    private final Map<String, CollectionSchema> schemas = new LinkedHashMap<>();
    private final Map<String, Map<String, JsonObject>> collections = new LinkedHashMap<>();

    private int searchCalls;
    private int createCalls;

    public int getSearchCalls() {
        return searchCalls;
    }

    public int getCreateCalls() {
        return createCalls;
    }

    public void resetCounters() {
        searchCalls = 0;
        createCalls = 0;
    }

    public Map<String, JsonObject> documents(String collectionName) {
        return collections.get(collectionName);
    }

    /**
     * 直接写入原始文档, 用于模拟历史数据(如损坏的 metadata)
     */
    public void putRaw(String collectionName, JsonObject document) {
        requireCollection(collectionName).put(document.get("id").getAsString(), document);
    }

    /**
     * num_documents 在 SDK 模型里是只读的, 通过 Jackson 构造
     */
    public static CollectionResponse collectionResponse(String name, List<Field> fields, long numDocuments) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", name);
        raw.put("fields", fields);
        raw.put("num_documents", numDocuments);
        return IOUtil.mapper().convertValue(raw, CollectionResponse.class);
    }

    @Override
    public CollectionResponse retrieveCollection(String collectionName) {
        CollectionSchema schema = schemas.get(collectionName);
        if (schema == null) throw new TypesenseObjectNotFoundException("No collection with name `" + collectionName + "` found.");
        return collectionResponse(schema.getName(), schema.getFields(), collections.get(collectionName).size());
    }

    @Override
    public CollectionResponse createCollection(CollectionSchema schema) {
        createCalls++;
        if (schemas.containsKey(schema.getName())) {
            throw new TypesenseObjectAlreadyExistsException("A collection with name `" + schema.getName() + "` already exists.");
        }
        schemas.put(schema.getName(), schema);
        collections.put(schema.getName(), new LinkedHashMap<>());
        return collectionResponse(schema.getName(), schema.getFields(), 0);
    }

    @Override
    public void deleteCollection(String collectionName) {
        if (schemas.remove(collectionName) == null) throw new TypesenseObjectNotFoundException("No collection with name `" + collectionName + "` found.");
        collections.remove(collectionName);
    }

    @Override
    public List<ImportResult> importDocuments(String collectionName, List<JsonObject> documents) {
        Map<String, JsonObject> docs = requireCollection(collectionName);
        List<ImportResult> results = new ArrayList<>();
        for (JsonObject document : documents) {
            docs.put(document.get("id").getAsString(), document.deepCopy());
            results.add(new ImportResult(true, null, null));
        }
        return results;
    }

    @Override
    public int deleteDocuments(String collectionName, String filterBy) {
        Map<String, JsonObject> docs = requireCollection(collectionName);
        Predicate<JsonObject> filter = parseFilter(filterBy);
        List<String> ids = docs.entrySet().stream()
                .filter(e -> filter.test(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();
        ids.forEach(docs::remove);
        return ids.size();
    }

    @Override
    public Map<String, Object> retrieveDocument(String collectionName, String id) {
        JsonObject doc = requireCollection(collectionName).get(id);
        if (doc == null) throw new TypesenseObjectNotFoundException("Could not find a document with id: " + id);
        return gson.fromJson(doc, MAP_TYPE);
    }

    @Override
    public void deleteDocument(String collectionName, String id) {
        if (requireCollection(collectionName).remove(id) == null) {
            throw new TypesenseObjectNotFoundException("Could not find a document with id: " + id);
        }
    }

    @Override
    public void upsertDocument(String collectionName, JsonObject document) {
        requireCollection(collectionName).put(document.get("id").getAsString(), document.deepCopy());
    }

    @Override
    public SearchResponse search(String collectionName, MultiSearchCollectionParameters parameters) {
        searchCalls++;
        Map<String, JsonObject> docs = requireCollection(collectionName);
        Predicate<JsonObject> filter = parseFilter(parameters.getFilterBy());

        List<SearchHit> candidates = new ArrayList<>();
        if (parameters.getVectorQuery() != null) {
            Matcher m = VECTOR_QUERY.matcher(parameters.getVectorQuery());
            if (!m.matches()) throw new TypesenseException(400, "Malformed vector query: " + parameters.getVectorQuery());
            String field = m.group(1);
            float[] query = parseVector(m.group(2));
            int k = Integer.parseInt(m.group(3));
            candidates = docs.values().stream()
                    .filter(filter)
                    .map(doc -> new SearchHit(toMap(doc, parameters.getExcludeFields()), cosineDistance(query, doc.getAsJsonArray(field))))
                    .sorted(Comparator.comparingDouble(SearchHit::getVectorDistance))
                    .limit(k)
                    .collect(Collectors.toCollection(ArrayList::new));
        } else {
            for (JsonObject doc : docs.values()) {
                if (filter.test(doc)) candidates.add(new SearchHit(toMap(doc, parameters.getExcludeFields()), null));
            }
        }

        int page = parameters.getPage() == null ? 1 : parameters.getPage();
        int perPage = parameters.getPerPage() == null ? 10 : parameters.getPerPage();
        int from = Math.min((page - 1) * perPage, candidates.size());
        int to = Math.min(from + perPage, candidates.size());
        return new SearchResponse((long) candidates.size(), page, new ArrayList<>(candidates.subList(from, to)));
    }

    private Map<String, JsonObject> requireCollection(String collectionName) {
        Map<String, JsonObject> docs = collections.get(collectionName);
        if (docs == null) throw new TypesenseObjectNotFoundException("No collection with name `" + collectionName + "` found.");
        return docs;
    }

    private Map<String, Object> toMap(JsonObject doc, String excludeFields) {
        Map<String, Object> map = gson.fromJson(doc, MAP_TYPE);
        if (excludeFields != null) {
            for (String field : excludeFields.split(",")) map.remove(field.trim());
        }
        return map;
    }

    private static float[] parseVector(String csv) {
        String[] parts = csv.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) vector[i] = Float.parseFloat(parts[i].trim());
        return vector;
    }

    private static double cosineDistance(float[] query, JsonArray stored) {
        double dot = 0, qn = 0, sn = 0;
        for (int i = 0; i < query.length && i < stored.size(); i++) {
            double s = stored.get(i).getAsDouble();
            dot += query[i] * s;
            qn += query[i] * query[i];
            sn += s * s;
        }
        if (qn == 0 || sn == 0) return 1.0;
        return 1.0 - dot / (Math.sqrt(qn) * Math.sqrt(sn));
    }

    /**
     * 只支持适配器生成的表达式: a && (b || c), 原子为 field:=`v` 或 field:!=`v`
     */
    static Predicate<JsonObject> parseFilter(String filterBy) {
        if (filterBy == null || filterBy.isBlank()) return doc -> true;
        Predicate<JsonObject> all = doc -> true;
        for (String clause : filterBy.split(" && ")) {
            String c = clause.trim();
            if (c.startsWith("(") && c.endsWith(")")) c = c.substring(1, c.length() - 1);
            Predicate<JsonObject> any = doc -> false;
            for (String atom : c.split(" \\|\\| ")) {
                any = any.or(parseAtom(atom.trim()));
            }
            all = all.and(any);
        }
        return all;
    }

    private static Predicate<JsonObject> parseAtom(String atom) {
        Matcher m = FILTER_ATOM.matcher(atom);
        if (!m.matches()) throw new TypesenseException(400, "Could not parse the filter query: " + atom);
        String field = m.group(1);
        boolean negate = "!=".equals(m.group(2));
        String value = m.group(3);
        return doc -> {
            JsonElement element = doc.get(field);
            boolean equal = element != null && !element.isJsonNull() && value.equals(element.getAsString());
            return negate != equal;
        };
    }
}
