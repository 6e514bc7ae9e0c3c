package com.thedigest.continuity.service.source;

import java.util.List;

public interface WatchlistSource {

    /**
     * @return tracked terms, de-duplicated case-insensitively, original casing kept
     */
    List<String> loadTerms();
}
