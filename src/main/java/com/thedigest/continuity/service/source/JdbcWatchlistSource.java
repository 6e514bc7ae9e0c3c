package com.thedigest.continuity.service.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class JdbcWatchlistSource implements WatchlistSource {

    private static final Logger logger = LoggerFactory.getLogger(JdbcWatchlistSource.class);

    static final int MAX_TERMS = 200;

    private final JdbcTemplate jdbcTemplate;

    public JdbcWatchlistSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<String> loadTerms() {
        List<String> names;
        try {
            names = jdbcTemplate.queryForList(
                    "select name from watchlist order by created_at desc limit ?",
                    String.class,
                    MAX_TERMS);
        } catch (DataAccessException e) {
            logger.error("Failed to load watchlist, continuing without it: {}", e.getMessage());
            return List.of();
        }
        return dedupe(names);
    }

    static List<String> dedupe(List<String> names) {
        Set<String> seen = new HashSet<>();
        List<String> terms = new ArrayList<>();
        for (String raw : names) {
            String name = raw == null ? "" : raw.trim();
            if (name.isEmpty()) continue;
            if (!seen.add(name.toLowerCase(Locale.ROOT))) continue;
            terms.add(name);
        }
        return terms;
    }
}
