package com.thedigest.continuity.service.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class JdbcEngagementSource implements EngagementSource {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEngagementSource.class);

    static final int MAX_EVENTS = 1200;
    static final String UNKNOWN_TOPIC = "unknown";

    private static final Map<String, Double> EVENT_WEIGHTS = Map.of(
            "click", 1.0,
            "expand", 2.0,
            "read", 3.0,
            "share", 4.0,
            "save", 5.0
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcEngagementSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Map<String, Double> topicEngagement() {
        List<EngagementEvent> events;
        try {
            events = jdbcTemplate.query("""
                            select e.event_type, a.topic
                            from engagement e
                            left join articles a on a.id = e.article_id
                            order by e.created_at desc
                            limit ?
                            """,
                    (rs, rowNum) -> new EngagementEvent(rs.getString("event_type"), rs.getString("topic")),
                    MAX_EVENTS);
        } catch (DataAccessException e) {
            logger.error("Failed to load engagement scores, continuing without them: {}", e.getMessage());
            return Map.of();
        }
        return aggregate(events);
    }

    static Map<String, Double> aggregate(List<EngagementEvent> events) {
        Map<String, Double> scores = new HashMap<>();
        for (EngagementEvent event : events) {
            String topic = event.topic() == null || event.topic().isBlank() ? UNKNOWN_TOPIC : event.topic();
            double weight = EVENT_WEIGHTS.getOrDefault(event.eventType(), 1.0);
            scores.merge(topic, weight, Double::sum);
        }
        return scores;
    }

    record EngagementEvent(String eventType, String topic) {
    }
}
