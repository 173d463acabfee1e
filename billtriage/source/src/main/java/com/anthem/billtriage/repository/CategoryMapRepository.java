package com.anthem.billtriage.repository;

import com.anthem.billtriage.config.BillTriageProperties;
import com.anthem.billtriage.model.CategoryMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Loads the procedure code category mapping from the procedure dimension table.
 */
@Repository
public class CategoryMapRepository {

    private static final Logger log = LoggerFactory.getLogger(CategoryMapRepository.class);

    private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private final JdbcTemplate jdbcTemplate;
    private final String categoryTable;

    public CategoryMapRepository(JdbcTemplate jdbcTemplate, BillTriageProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.categoryTable = properties.getCategoryTable();
        if (!TABLE_NAME.matcher(categoryTable).matches()) {
            throw new IllegalArgumentException("Invalid category table name: " + categoryTable);
        }
    }

    /**
     * Snapshot of every categorized procedure code.
     */
    public CategoryMap load() {
        Map<String, List<String>> codesByCategory = new LinkedHashMap<>();
        String sql = "SELECT proc_cd, category FROM " + categoryTable
                + " WHERE category IS NOT NULL ORDER BY category, proc_cd";

        jdbcTemplate.query(sql, (RowCallbackHandler) rs -> {
            String code = rs.getString("proc_cd");
            String category = rs.getString("category");
            if (code != null && category != null && !category.isBlank()) {
                codesByCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(code);
            }
        });

        CategoryMap categoryMap = new CategoryMap(codesByCategory);
        log.debug("Loaded category map: table={}, categories={}", categoryTable, categoryMap.categories().size());
        return categoryMap;
    }
}
