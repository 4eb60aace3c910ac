package com.example.expensechat.service.sql.dto;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * UPDATE trên đúng một bảng sở hữu.
 *
 * @param orderBy các mục ORDER BY đã render (MySQL cho phép với UPDATE một bảng)
 * @param limit   LIMIT hoặc null
 */
public record UpdateStatement(OwnedTable table,
                              List<Assignment> assignments,
                              List<Predicate> filters,
                              List<String> orderBy,
                              Long limit) implements ClassifiedStatement {

    public UpdateStatement {
        assignments = List.copyOf(assignments);
        filters = List.copyOf(filters);
        orderBy = List.copyOf(orderBy);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.UPDATE;
    }

    public Set<String> assignedColumns() {
        return assignments.stream().map(Assignment::column).collect(Collectors.toCollection(java.util.LinkedHashSet::new));
    }

    public UpdateStatement withFilters(List<Predicate> newFilters) {
        return new UpdateStatement(table, assignments, newFilters, orderBy, limit);
    }
}
