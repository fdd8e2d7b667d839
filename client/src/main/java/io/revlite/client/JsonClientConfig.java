// file: client/src/main/java/io/revlite/client/JsonClientConfig.java
package io.revlite.client;

/**
 * JSON shape of a client config file. Example:
 *   {
 *     "url": "ws://localhost:8080/api/storage/memory",
 *     "space": "did:key:revlite-dev",
 *     "clientId": "laptop-1",
 *     "cacheDir": "./data/cache"
 *   }
 */
public class JsonClientConfig {
    public String url;
    public String space;
    public String clientId;
    public String authorization;
    public String mediaType;
    public Long connectionTimeoutMillis;
    public Long syncDebounceMillis;
    public Integer pullRetryLimit;
    public String cacheDir;
    public Integer maxHeapEntries;
}
