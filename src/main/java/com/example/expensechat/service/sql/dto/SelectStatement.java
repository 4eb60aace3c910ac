package com.example.expensechat.service.sql.dto;

import java.util.List;

/**
 * SELECT trên chuỗi sở hữu. {@code baseTable} là bảng sâu nhất được tham chiếu,
 * {@code joins} là các JOIN (sau khi rewrite luôn là chuỗi chuẩn).
 */
public record SelectStatement(boolean distinct,
                              List<SelectItem> projection,
                              OwnedTable baseTable,
                              List<Join> joins,
                              List<Predicate> filters,
                              List<String> groupBy,
                              String having,
                              List<String> orderBy,
                              Long limit,
                              Long offset) implements ClassifiedStatement {

    public SelectStatement {
        projection = List.copyOf(projection);
        joins = List.copyOf(joins);
        filters = List.copyOf(filters);
        groupBy = List.copyOf(groupBy);
        orderBy = List.copyOf(orderBy);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.SELECT;
    }

    public boolean aggregated() {
        return !groupBy.isEmpty() || projection.stream().anyMatch(SelectItem::aggregate);
    }

    public SelectStatement withScope(List<SelectItem> newProjection, List<Join> newJoins,
                                     List<Predicate> newFilters, Long newLimit) {
        return new SelectStatement(distinct, newProjection, baseTable, newJoins, newFilters,
                groupBy, having, orderBy, newLimit, offset);
    }
}
