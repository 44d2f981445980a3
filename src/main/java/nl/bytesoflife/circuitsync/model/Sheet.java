package nl.bytesoflife.circuitsync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A circuit or subcircuit sheet. The parent is referenced by path only.
 */
public class Sheet {

    private int id = -1;
    private final String name;
    private final String path;
    private final String parentPath;
    private String token;
    private String fileName;
    private final List<String> childPaths = new ArrayList<>();
    private final List<Integer> componentIds = new ArrayList<>();
    private final List<Integer> netIds = new ArrayList<>();
    private final Map<String, HierarchicalPort> ports = new LinkedHashMap<>();

    public Sheet(String name, String path, String parentPath) {
        this.name = name;
        this.path = path;
        this.parentPath = parentPath;
    }

    public static Sheet root(String name) {
        return new Sheet(name, "/", null);
    }

    public static String childPath(String parentPath, String childName) {
        return parentPath + childName + "/";
    }

    public int getId() {
        return id;
    }

    void setId(int id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public String getPath() {
        return path;
    }

    public String getParentPath() {
        return parentPath;
    }

    public boolean isRoot() {
        return parentPath == null;
    }

    public String getToken() {
        return token;
    }

    public Sheet setToken(String token) {
        this.token = token;
        return this;
    }

    public String getFileName() {
        return fileName;
    }

    public Sheet setFileName(String fileName) {
        this.fileName = fileName;
        return this;
    }

    public List<String> getChildPaths() {
        return Collections.unmodifiableList(childPaths);
    }

    void addChildPath(String path) {
        childPaths.add(path);
    }

    public List<Integer> getComponentIds() {
        return Collections.unmodifiableList(componentIds);
    }

    void addComponentId(int id) {
        componentIds.add(id);
    }

    public List<Integer> getNetIds() {
        return Collections.unmodifiableList(netIds);
    }

    void addNetId(int id) {
        netIds.add(id);
    }

    public Map<String, HierarchicalPort> getPorts() {
        return Collections.unmodifiableMap(ports);
    }

    public Sheet putPort(HierarchicalPort port) {
        ports.put(port.name(), port);
        return this;
    }

    @Override
    public String toString() {
        return "Sheet{" + path + ", ports=" + ports.keySet() + "}";
    }
}
