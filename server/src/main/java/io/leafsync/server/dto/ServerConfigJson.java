// file: server/src/main/java/io/leafsync/server/dto/ServerConfigJson.java
package io.leafsync.server.dto;

/**
 * JSON form of the hub server configuration. Every field is optional;
 * command line flags override whatever is set here.
 */
public class ServerConfigJson {
    public String host;
    public Integer port;
    public String storage;
    public String dataDir;
}
