package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id","name","viewpoint","folderId","documentation","nodes","connections","externalIds","meta"})
public final class IrView {
    public final String id;
    public final String name;
    public final String viewpoint;
    public final String folderId;
    public final String documentation;
    public final List<IrViewNode> nodes;
    public final List<IrViewConnection> connections;
    public final List<IrExternalId> externalIds;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrView(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("viewpoint") String viewpoint,
            @JsonProperty("folderId") String folderId,
            @JsonProperty("documentation") String documentation,
            @JsonProperty("nodes") List<IrViewNode> nodes,
            @JsonProperty("connections") List<IrViewConnection> connections,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.name = name;
        this.viewpoint = viewpoint;
        this.folderId = folderId;
        this.documentation = documentation;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.connections = connections == null ? List.of() : List.copyOf(connections);
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.meta = IrMaps.copy(meta);
    }

    public IrView withNodes(List<IrViewNode> nodes) {
        return new IrView(id, name, viewpoint, folderId, documentation, nodes, connections, externalIds, meta);
    }

    public IrView withConnections(List<IrViewConnection> connections) {
        return new IrView(id, name, viewpoint, folderId, documentation, nodes, connections, externalIds, meta);
    }

    public IrView withFolderId(String folderId) {
        return new IrView(id, name, viewpoint, folderId, documentation, nodes, connections, externalIds, meta);
    }

    public IrView withText(String name, String viewpoint, String documentation) {
        return new IrView(id, name, viewpoint, folderId, documentation, nodes, connections, externalIds, meta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrView)) return false;
        IrView that = (IrView) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(viewpoint, that.viewpoint) &&
                Objects.equals(folderId, that.folderId) &&
                Objects.equals(documentation, that.documentation) &&
                Objects.equals(nodes, that.nodes) &&
                Objects.equals(connections, that.connections) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, viewpoint, folderId, documentation, nodes, connections, externalIds, meta);
    }

    @Override public String toString() {
        return "IrView{" + id + ", " + name + ", nodes=" + nodes.size() + ", connections=" + connections.size() + "}";
    }
}
