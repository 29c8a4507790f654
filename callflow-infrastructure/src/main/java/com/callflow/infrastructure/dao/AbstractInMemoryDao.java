package com.callflow.infrastructure.dao;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * 内存表 DAO 基类，语义对齐关系库：写入返回影响行数，带版本号的更新在版本不一致时影响 0 行。
 * 读写均复制 PO，调用方拿到的对象不会与存储共享。
 *
 * @param <P> PO 类型
 */
public abstract class AbstractInMemoryDao<P> {

    protected final Map<String, P> table = new ConcurrentHashMap<>();

    protected abstract String keyOf(P po);

    protected abstract Integer versionOf(P po);

    protected abstract P copy(P po, Integer version);

    public int insert(P po) {
        return table.putIfAbsent(keyOf(po), copy(po, 0)) == null ? 1 : 0;
    }

    public int updateWithVersion(P po) {
        String key = keyOf(po);
        Integer expected = versionOf(po);
        int[] affected = {0};
        table.computeIfPresent(key, (k, current) -> {
            if (expected == null || !expected.equals(versionOf(current))) {
                return current;
            }
            affected[0] = 1;
            return copy(po, expected + 1);
        });
        return affected[0];
    }

    public int deleteByKey(String key) {
        return table.remove(key) != null ? 1 : 0;
    }

    public P selectByKey(String key) {
        if (key == null) {
            return null;
        }
        P po = table.get(key);
        return po == null ? null : copy(po, versionOf(po));
    }

    public List<P> selectAll() {
        return selectWhere(po -> true);
    }

    protected List<P> selectWhere(Predicate<P> filter) {
        List<P> rows = new ArrayList<>();
        for (P po : table.values()) {
            if (filter.test(po)) {
                rows.add(copy(po, versionOf(po)));
            }
        }
        return rows;
    }
}
