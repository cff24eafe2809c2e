package ir;

import exception.IRException;
import ir.type.StructType;
import ir.value.Function;
import ir.value.GlobalVariable;
import util.IList;
import util.LoggingManager;
import util.logging.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * Top-level container: functions, globals and named struct types, each kept
 * in insertion order. Name lookups are linear scans and nothing checks for
 * duplicate names.
 */
public class IRModule {
    private static final Logger log = LoggingManager.getLogger(IRModule.class);

    private final String moduleName;

    private final IList<Function, IRModule> functions;
    private final List<GlobalVariable> globalVariables = new ArrayList<>();

    // 命名结构体类型, 按声明顺序打印
    private final Map<String, StructType> namedTypes = new LinkedHashMap<>();

    private String dataLayout = "";
    private String targetTriple = "";

    public IRModule(String name) {
        this.moduleName = name;
        this.functions = new IList<>(this);
    }

    public String getName() {
        return moduleName;
    }

    /* target */
    public String getDataLayout() {
        return dataLayout;
    }

    public void setDataLayout(String dataLayout) {
        this.dataLayout = dataLayout == null ? "" : dataLayout;
    }

    public String getTargetTriple() {
        return targetTriple;
    }

    public void setTargetTriple(String targetTriple) {
        this.targetTriple = targetTriple == null ? "" : targetTriple;
    }

    /* functions */
    public void addFunction(Function function) {
        function._getINode().insertAtEnd(functions);
        function.setParent(this);
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions.values());
    }

    public @Nullable Function getFunction(String name) {
        for (var node : functions) {
            if (name.equals(node.getVal().getName())) {
                return node.getVal();
            }
        }
        return null;
    }

    /* globals */
    public void addGlobal(GlobalVariable global) {
        globalVariables.add(global);
        global.setParent(this);
    }

    public List<GlobalVariable> getGlobalVariables() {
        return Collections.unmodifiableList(globalVariables);
    }

    public @Nullable GlobalVariable getGlobal(String name) {
        for (GlobalVariable global : globalVariables) {
            if (name.equals(global.getName())) {
                return global;
            }
        }
        return null;
    }

    /* named types */
    public void addNamedType(StructType type) {
        if (!type.isNamed()) {
            throw IRException.illegalOperand("only named struct types can be registered");
        }
        namedTypes.put(type.getName(), type);
    }

    public @Nullable StructType getNamedType(String name) {
        return namedTypes.get(name);
    }

    public Map<String, StructType> getNamedTypes() {
        return Collections.unmodifiableMap(namedTypes);
    }

    @Override
    public String toString() {
        return toIR();
    }

    public String toIR() {
        StringBuilder sb = new StringBuilder();

        // target information
        if (!dataLayout.isEmpty()) {
            sb.append("target datalayout = \"").append(dataLayout).append("\"\n");
        }
        if (!targetTriple.isEmpty()) {
            sb.append("target triple = \"").append(targetTriple).append("\"\n");
        }
        if (!dataLayout.isEmpty() || !targetTriple.isEmpty()) {
            sb.append("\n");
        }

        for (var entry : namedTypes.entrySet()) {
            sb.append("%").append(entry.getKey()).append(" = type ")
              .append(entry.getValue().getBodyIR()).append("\n");
        }
        if (!namedTypes.isEmpty()) {
            sb.append("\n");
        }

        // Global variable definitions
        for (GlobalVariable global : globalVariables) {
            sb.append(global.toIR()).append("\n");
        }
        if (!globalVariables.isEmpty()) {
            sb.append("\n");
        }

        boolean first = true;
        for (var node : functions) {
            if (!first) {
                sb.append("\n");
            }
            sb.append(node.getVal().toIR()).append("\n");
            first = false;
        }
        return sb.toString();
    }

    public void printToFile(Path path) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(this.toIR());
        }
        log.debug("Wrote module {} to {}", moduleName, path);
    }
}
