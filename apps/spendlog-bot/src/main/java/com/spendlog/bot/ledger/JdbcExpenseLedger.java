package com.spendlog.bot.ledger;

import com.spendlog.bot.model.Expense;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcExpenseLedger implements ExpenseLedger {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcExpenseLedger(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Expense save(Expense expense) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", expense.userId())
                .addValue("amount", expense.amount().setScale(2, RoundingMode.HALF_UP))
                .addValue("category", expense.category());
        String sql;
        if (expense.createdAt() != null) {
            params.addValue("createdAt", Timestamp.from(expense.createdAt()));
            sql = """
                    INSERT INTO expenses (user_id, amount, category, created_at)
                    VALUES (:userId, :amount, :category, :createdAt)
                    """;
        } else {
            sql = """
                    INSERT INTO expenses (user_id, amount, category)
                    VALUES (:userId, :amount, :category)
                    """;
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(sql, params, keyHolder, new String[] {"id"});
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new DataRetrievalFailureException("Insert into expenses returned no generated id");
        }
        return expense.withId(key.longValue());
    }

    @Override
    public Summary summarize(long userId, Instant fromInclusive, Instant toInclusive) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("from", Timestamp.from(fromInclusive))
                .addValue("to", Timestamp.from(toInclusive));

        List<CategoryTotal> categories = jdbcTemplate.query("""
                SELECT category,
                       CAST(sum(amount) AS NUMERIC(12, 2)) AS total
                FROM expenses
                WHERE user_id = :userId
                  AND created_at >= :from
                  AND created_at <= :to
                GROUP BY category
                ORDER BY total DESC, category ASC
                """, params, (rs, rowNum) -> new CategoryTotal(
                rs.getString("category"),
                scaled(rs.getBigDecimal("total"))));

        BigDecimal grandTotal = jdbcTemplate.queryForObject("""
                SELECT CAST(coalesce(sum(amount), 0) AS NUMERIC(12, 2)) AS grand_total
                FROM expenses
                WHERE user_id = :userId
                  AND created_at >= :from
                  AND created_at <= :to
                """, params, (rs, rowNum) -> rs.getBigDecimal("grand_total"));

        return new Summary(categories, scaled(grandTotal));
    }

    private BigDecimal scaled(BigDecimal value) {
        return (value != null ? value : BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
    }
}
