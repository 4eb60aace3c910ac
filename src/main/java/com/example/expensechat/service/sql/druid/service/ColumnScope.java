package com.example.expensechat.service.sql.druid.service;

import com.example.expensechat.exception.ValidationException;
import com.example.expensechat.service.sql.dto.ColumnRef;
import com.example.expensechat.service.sql.dto.OwnedTable;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bảng tên (alias → bảng) dùng khi render cột.
 * SELECT: cột được in dạng {@code alias.cột} với alias chuẩn b/c/e.
 * UPDATE: cột được in trần, chỉ được thuộc đúng bảng đang cập nhật.
 */
final class ColumnScope {

    private final Map<String, OwnedTable> owners;
    private final List<OwnedTable> searchOrder;
    private final boolean qualify;
    private final Set<String> selectAliases;

    private ColumnScope(Map<String, OwnedTable> owners, List<OwnedTable> searchOrder,
                        boolean qualify, Set<String> selectAliases) {
        this.owners = owners;
        this.searchOrder = searchOrder;
        this.qualify = qualify;
        this.selectAliases = selectAliases;
    }

    /**
     * @param declared alias/tên bảng xuất hiện trong FROM/JOIN (đã lower-case)
     * @param base     bảng sâu nhất được tham chiếu
     */
    static ColumnScope forSelect(Map<String, OwnedTable> declared, OwnedTable base, Set<String> selectAliases) {
        Map<String, OwnedTable> owners = new LinkedHashMap<>(declared);
        List<OwnedTable> chain = java.util.Arrays.stream(OwnedTable.values())
                .filter(t -> t.depth() <= base.depth())
                .sorted(Comparator.comparingInt(OwnedTable::depth).reversed())
                .toList();
        // bảng nông hơn luôn được JOIN lại sau khi rewrite nên alias chuẩn của chúng luôn dùng được
        for (OwnedTable t : chain) {
            owners.putIfAbsent(t.alias(), t);
            owners.putIfAbsent(t.tableName(), t);
        }
        Set<String> aliases = selectAliases.stream()
                .map(a -> a.toLowerCase(Locale.ROOT))
                .collect(java.util.stream.Collectors.toUnmodifiableSet());
        return new ColumnScope(owners, chain, true, aliases);
    }

    static ColumnScope forUpdate(OwnedTable table, String declaredAlias) {
        Map<String, OwnedTable> owners = new LinkedHashMap<>();
        owners.put(table.tableName(), table);
        if (declaredAlias != null) owners.put(declaredAlias.toLowerCase(Locale.ROOT), table);
        return new ColumnScope(owners, List.of(table), false, Set.of());
    }

    /** Không có bảng nào: dùng cho VALUES của INSERT. */
    static ColumnScope none() {
        return new ColumnScope(Map.of(), List.of(), false, Set.of());
    }

    boolean isSelectAlias(String name) {
        return selectAliases.contains(name.toLowerCase(Locale.ROOT));
    }

    Optional<ColumnRef> resolveBare(String name) {
        for (OwnedTable t : searchOrder) {
            Optional<String> col = t.canonicalColumn(name);
            if (col.isPresent()) return Optional.of(new ColumnRef(t, col.get()));
        }
        return Optional.empty();
    }

    ColumnRef resolveQualified(String owner, String name) {
        OwnedTable table = table(owner);
        return table.canonicalColumn(name)
                .map(c -> new ColumnRef(table, c))
                .orElseThrow(() -> new ValidationException("column", owner + "." + name,
                        "Unknown column \"%s\" on table %s".formatted(name, table.tableName())));
    }

    OwnedTable table(String owner) {
        OwnedTable table = owners.get(owner.toLowerCase(Locale.ROOT));
        if (table == null) {
            String message = qualify
                    ? "Unknown table alias \"%s\"".formatted(owner)
                    : "Statement can only reference columns of %s".formatted(searchOrder.isEmpty() ? "its own table" : searchOrder.get(0).tableName());
            throw new ValidationException("table", owner, message);
        }
        return table;
    }

    String render(ColumnRef ref) {
        return qualify ? ref.qualified() : ref.column();
    }

    String renderStar(OwnedTable table) {
        return qualify ? table.alias() + ".*" : "*";
    }
}
