package com.warden.security;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * Endpoint parameters of a bearer token policy, published to clients in the policy's
 * issuer endpoint URL as JSON.
 * <pre>
 * {"ua:authorityUrl":"https://login.example.com/tenant",
 *  "ua:authorityProfileUri":"http://opcfoundation.org/UA/Authorization#AzureAD",
 *  "ua:scopes":["UAServer"]}
 * </pre>
 *
 * @param authorityUrl          base URL of the token authority (required)
 * @param authorityProfileUri   profile of the authority
 * @param tokenEndpoint         token endpoint relative to the authority URL
 * @param authorizationEndpoint authorization endpoint relative to the authority URL
 * @param requestTypes          grant types the authority supports
 * @param resourceId            resource id the token must be issued for
 * @param scopes                scopes a client may request
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BearerTokenParameters(
        @JsonProperty("ua:authorityUrl") String authorityUrl,
        @JsonProperty("ua:authorityProfileUri") String authorityProfileUri,
        @JsonProperty("ua:tokenEndpoint") String tokenEndpoint,
        @JsonProperty("ua:authorizationEndpoint") String authorizationEndpoint,
        @JsonProperty("ua:requestTypes") List<String> requestTypes,
        @JsonProperty("ua:resourceId") String resourceId,
        @JsonProperty("ua:scopes") List<String> scopes
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public BearerTokenParameters {
        requestTypes = requestTypes == null ? List.of() : List.copyOf(requestTypes);
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    /**
     * Parses the JSON form of the parameters.
     *
     * @param json the policy's issuer endpoint URL
     * @return the parsed parameters
     * @throws MalformedParametersException if the JSON is missing, malformed or lacks an absolute authority URL
     */
    public static BearerTokenParameters fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedParametersException("bearer token parameters are missing", null);
        }
        BearerTokenParameters parameters;
        try {
            parameters = MAPPER.readValue(json, BearerTokenParameters.class);
        } catch (JsonProcessingException e) {
            throw new MalformedParametersException("bearer token parameters are not valid JSON", e);
        }
        if (parameters == null || parameters.authorityUrl() == null || parameters.authorityUrl().isBlank()) {
            throw new MalformedParametersException("bearer token parameters have no authority URL", null);
        }
        parameters.authorityUri();
        return parameters;
    }

    /**
     * Serializes the parameters to the JSON form stored in a policy.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new MalformedParametersException("failed to serialize bearer token parameters", e);
        }
    }

    /**
     * The authority URL as an absolute URI.
     *
     * @throws MalformedParametersException if the URL is not an absolute URI
     */
    public URI authorityUri() {
        if (authorityUrl == null || authorityUrl.isBlank()) {
            throw new MalformedParametersException("bearer token parameters have no authority URL", null);
        }
        try {
            URI uri = new URI(authorityUrl);
            if (!uri.isAbsolute()) {
                throw new MalformedParametersException("authority URL is not absolute: " + authorityUrl, null);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new MalformedParametersException("authority URL is not a valid URI: " + authorityUrl, e);
        }
    }

    /**
     * Thrown when a policy's bearer token parameters cannot be used.
     */
    public static class MalformedParametersException extends RuntimeException {
        public MalformedParametersException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
