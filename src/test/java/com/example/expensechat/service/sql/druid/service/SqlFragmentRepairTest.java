package com.example.expensechat.service.sql.druid.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SqlFragmentRepairTest {

    private final SqlFragmentRepair repair = new SqlFragmentRepair();

    @Test
    void removesDanglingConnectorsAndEmptyWhere() {
        assertThat(repair.repair("SELECT * FROM expenses WHERE amount > 5 AND"))
                .isEqualTo("SELECT * FROM expenses WHERE amount > 5");
        assertThat(repair.repair("SELECT * FROM expenses WHERE"))
                .isEqualTo("SELECT * FROM expenses");
        assertThat(repair.repair("SELECT * FROM expenses WHERE AND amount > 5"))
                .isEqualTo("SELECT * FROM expenses WHERE amount > 5");
    }

    @Test
    void removesConnectorBeforeOrderByAndLimit() {
        assertThat(repair.repair("SELECT * FROM expenses WHERE amount > 5 AND ORDER BY date DESC"))
                .isEqualTo("SELECT * FROM expenses WHERE amount > 5 ORDER BY date DESC");
        assertThat(repair.repair("SELECT * FROM expenses WHERE LIMIT 5"))
                .isEqualTo("SELECT * FROM expenses LIMIT 5");
    }

    @Test
    void leavesLiteralsAndValidSqlAlone() {
        String sql = "SELECT * FROM expenses WHERE description = 'rent and' AND amount > 5";
        assertThat(repair.repair(sql)).isEqualTo(sql);
    }
}
