package com.thedigest.continuity.service.source;

import java.util.Map;

public interface EngagementSource {

    /**
     * @return weighted interaction totals per topic
     */
    Map<String, Double> topicEngagement();
}
