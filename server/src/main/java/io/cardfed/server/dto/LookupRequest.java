package io.cardfed.server.dto;

import java.util.List;

/**
 * JSON body for POST /profiles/{game}/{version}/lookup.
 *   { "userIds": ["12", "-E004010000000001"] }
 */
public class LookupRequest {
    public List<String> userIds;
}
