package dev.nodalis.project;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One {@code <Map>} row of the project's mapping table: a remote I/O point
 * read or written over a field protocol and the internal address it feeds.
 * The protocol is one of {@code MODBUS-TCP}, {@code MODBUS-RTU},
 * {@code OPCUA} or {@code BACNET-IP}.
 */
public final class MappingEntry {

    private final String moduleId;
    private final String modulePort;
    private final String protocol;
    private final String remoteAddress;
    private final String remoteSize;
    private final String internalAddress;
    private final String resource;
    private final String pollTime;
    private final String protocolProperties;

    public MappingEntry(String moduleId, String modulePort, String protocol, String remoteAddress,
                        String remoteSize, String internalAddress, String resource, String pollTime,
                        String protocolProperties) {
        this.moduleId = Objects.requireNonNull(moduleId, "moduleId");
        this.modulePort = Objects.requireNonNull(modulePort, "modulePort");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        this.remoteSize = Objects.requireNonNull(remoteSize, "remoteSize");
        this.internalAddress = Objects.requireNonNull(internalAddress, "internalAddress");
        this.resource = Objects.requireNonNull(resource, "resource");
        this.pollTime = Objects.requireNonNull(pollTime, "pollTime");
        this.protocolProperties = Objects.requireNonNull(protocolProperties, "protocolProperties");
    }

    public String getModuleId() {
        return moduleId;
    }

    public String getModulePort() {
        return modulePort;
    }

    public String getProtocol() {
        return protocol;
    }

    public String getRemoteAddress() {
        return remoteAddress;
    }

    public String getRemoteSize() {
        return remoteSize;
    }

    public String getInternalAddress() {
        return internalAddress;
    }

    public String getResource() {
        return resource;
    }

    public String getPollTime() {
        return pollTime;
    }

    public String getProtocolProperties() {
        return protocolProperties;
    }

    /**
     * The entry as a JSON object, then escaped so that it can sit inside a
     * double-quoted string literal of the generated runtime.
     */
    String toDirective() {
        ObjectNode json = JsonNodeFactory.instance.objectNode()
                .put("ModuleID", moduleId)
                .put("ModulePort", modulePort)
                .put("Protocol", protocol)
                .put("RemoteAddress", remoteAddress)
                .put("RemoteSize", remoteSize)
                .put("InternalAddress", internalAddress)
                .put("Resource", resource)
                .put("PollTime", pollTime)
                .put("ProtocolProperties", protocolProperties);
        String escaped = json.toString().replace("\\", "\\\\").replace("\"", "\\\"");
        return "//Map=" + escaped;
    }
}
