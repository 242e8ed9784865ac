package io.cardfed.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One entry of a batch/enumeration response.
 * When no profile was found:
 *   { "userId": "-E004010000000001", "found": false }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserProfileResponse {
    public String userId;
    public boolean found;
    public Map<String, Object> profile; // present when found
}
