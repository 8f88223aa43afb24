package com.warden.security.apikey;

/**
 * Transport facts about the request presenting an API key.
 *
 * @param ipAddress client address, nullable when unknown
 * @param https     whether the request arrived over TLS
 * @param userAgent nullable
 * @param method    HTTP method, nullable
 * @param path      request path, nullable
 */
public record ApiRequestInfo(String ipAddress, boolean https, String userAgent, String method, String path) {

    public static ApiRequestInfo of(String ipAddress, boolean https) {
        return new ApiRequestInfo(ipAddress, https, null, null, null);
    }
}
