package com.gdin.inspection.semanticrouter.route;

import lombok.Value;

@Value
public class SyncReport {
    // 本地与远端哈希一致, 没有做任何写入
    boolean unchanged;

    int added;

    int removed;

    String hash;

    public static SyncReport unchanged(String hash) {
        return new SyncReport(true, 0, 0, hash);
    }
}
