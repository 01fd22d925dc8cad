package org.reportforge.compiler.frontend.parser;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigSyntax;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.api.SourceInfo;
import org.reportforge.compiler.diagnostics.DiagnosticsEngine;
import org.reportforge.compiler.frontend.parser.ast.CellNode;
import org.reportforge.compiler.frontend.parser.ast.ItemNode;
import org.reportforge.compiler.frontend.parser.ast.LayoutNode;
import org.reportforge.compiler.frontend.parser.ast.LineNode;
import org.reportforge.compiler.frontend.parser.ast.ReportNode;
import org.reportforge.compiler.frontend.parser.ast.RowNode;
import org.reportforge.compiler.frontend.parser.ast.SectionMember;
import org.reportforge.compiler.frontend.parser.ast.SectionNode;
import org.reportforge.compiler.ir.LayoutKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Loads report and layout definitions written in HOCON into the authoring AST.
 * <p>
 * Only the structure is checked here: which keys hold lists, objects and integers.
 * Track declarations and property values are kept raw and validated during IR
 * generation. Unknown keys are reported as warnings to the {@link DiagnosticsEngine}.
 */
public class LayoutDefinitionParser {

    private static final Set<String> CONTAINER_PROPERTIES = Set.of(
            "columns", "rows", "gutter", "column-gutter", "row-gutter", "align", "inset", "fill", "stroke");
    private static final Set<String> STACK_PROPERTIES = Set.of("dir", "spacing");
    private static final Set<String> ROW_PROPERTIES = Set.of("height", "fill", "stroke", "align", "inset");
    private static final Set<String> CELL_PROPERTIES = Set.of("align", "inset", "fill", "stroke", "breakable");
    private static final Set<String> CELL_KEYS = Set.of("x", "y", "colspan", "rowspan", "content");
    private static final Set<String> ITEM_KEYS = Set.of(
            "type", "text", "source", "format", "decimal-places", "style",
            "font-size", "font-weight", "font-style", "color", "font-family", "text-align");
    private static final Set<String> LINE_KEYS = Set.of("x", "y", "start", "end", "stroke");

    private final DiagnosticsEngine diagnostics;
    private String fileName = "unknown";

    /**
     * Constructs a new parser.
     * @param diagnostics The engine for reporting warnings.
     */
    public LayoutDefinitionParser(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Parses a report definition. The layouts are read from {@code report.layouts};
     * a document without a {@code report} block is read as the report itself.
     *
     * @param source The HOCON text.
     * @param fileName The name used in source positions and as the default report name.
     * @return The report AST.
     * @throws CompilationException if the definition is structurally invalid.
     */
    public ReportNode parseReport(String source, String fileName) throws CompilationException {
        Config root = load(source, fileName);
        try {
            ConfigObject report = root.hasPath("report") ? root.getObject("report") : root.root();
            SourceInfo info = info(report);
            String name = report.containsKey("name") ? string(report.get("name"), "name") : defaultName(fileName);
            ConfigValue layoutsValue = report.get("layouts");
            if (layoutsValue == null) {
                throw new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION,
                        "A report must declare 'layouts'", null, info);
            }
            List<LayoutNode> layouts = new ArrayList<>();
            for (ConfigValue value : list(layoutsValue, "layouts")) {
                layouts.add(layout(object(value, "layout")));
            }
            warnUnknown(report, Set.of("name", "layouts"), "report");
            return new ReportNode(name, layouts, info);
        } catch (ConfigException e) {
            throw wrap(e);
        }
    }

    /**
     * Parses a document that holds a single layout definition at its root.
     *
     * @param source The HOCON text.
     * @param fileName The name used in source positions.
     * @return The layout AST.
     * @throws CompilationException if the definition is structurally invalid or has no supported type.
     */
    public LayoutNode parseLayout(String source, String fileName) throws CompilationException {
        Config root = load(source, fileName);
        try {
            return layout(root.root());
        } catch (ConfigException e) {
            throw wrap(e);
        }
    }

    private Config load(String source, String fileName) throws CompilationException {
        this.fileName = fileName;
        try {
            ConfigParseOptions options = ConfigParseOptions.defaults()
                    .setSyntax(ConfigSyntax.CONF)
                    .setOriginDescription(fileName);
            return ConfigFactory.parseString(source, options).resolve();
        } catch (ConfigException e) {
            throw wrap(e);
        }
    }

    private LayoutNode layout(ConfigObject obj) throws CompilationException {
        SourceInfo info = info(obj);
        ConfigValue typeValue = obj.get("type");
        if (typeValue == null || typeValue.valueType() != ConfigValueType.STRING) {
            throw new CompilationException(CompilerErrorCode.UNSUPPORTED_LAYOUT_TYPE,
                    "Layout has no type; expected grid, table or stack", typeValue == null ? null : typeValue.unwrapped(), info);
        }
        String type = (String) typeValue.unwrapped();
        Optional<LayoutKind> kind = LayoutKind.fromKeyword(type);
        if (kind.isEmpty()) {
            throw new CompilationException(CompilerErrorCode.UNSUPPORTED_LAYOUT_TYPE,
                    "Unsupported layout type '" + type + "'; expected grid, table or stack", type, info);
        }
        return layout(kind.get(), obj, info);
    }

    private LayoutNode layout(LayoutKind kind, ConfigObject obj, SourceInfo info) throws CompilationException {
        Set<String> propertyKeys = kind == LayoutKind.STACK ? STACK_PROPERTIES : CONTAINER_PROPERTIES;
        Map<String, Object> attributes = attributes(obj, propertyKeys);
        List<ItemNode> elements = items(obj.get("elements"), "elements");

        if (kind == LayoutKind.STACK) {
            warnUnknown(obj, union(Set.of("type", "elements"), STACK_PROPERTIES), "stack");
            return new LayoutNode(kind, attributes, null, null, elements, null, null, null, info);
        }

        List<RowNode> body = new ArrayList<>();
        for (ConfigValue value : optionalList(obj.get("body"), "body")) {
            body.add(row(object(value, "row")));
        }
        List<CellNode> cells = new ArrayList<>();
        for (ConfigValue value : optionalList(obj.get("cells"), "cells")) {
            cells.add(cell(object(value, "cell")));
        }
        List<LineNode> lines = new ArrayList<>();
        for (ConfigValue value : optionalList(obj.get("lines"), "lines")) {
            lines.add(line(object(value, "line")));
        }

        List<SectionNode> headers = new ArrayList<>();
        List<SectionNode> footers = new ArrayList<>();
        Set<String> known = union(Set.of("type", "body", "cells", "elements", "lines"), CONTAINER_PROPERTIES);
        if (kind == LayoutKind.TABLE) {
            for (ConfigValue value : optionalList(obj.get("headers"), "headers")) {
                headers.add(section(value, "header"));
            }
            for (ConfigValue value : optionalList(obj.get("footers"), "footers")) {
                footers.add(section(value, "footer"));
            }
            known = union(known, Set.of("headers", "footers"));
        }
        warnUnknown(obj, known, kind.keyword());
        return new LayoutNode(kind, attributes, body, cells, elements, headers, footers, lines, info);
    }

    private SectionNode section(ConfigValue value, String what) throws CompilationException {
        SourceInfo info = info(value);
        if (value.valueType() == ConfigValueType.LIST) {
            return new SectionNode(null, null, members((ConfigList) value), info);
        }
        ConfigObject obj = object(value, what);
        Boolean repeat = obj.containsKey("repeat") ? bool(obj.get("repeat"), "repeat") : null;
        Integer level = obj.containsKey("level") ? integer(obj.get("level"), "level") : null;
        List<SectionMember> members = obj.containsKey("rows")
                ? members(list(obj.get("rows"), "rows"))
                : List.of();
        warnUnknown(obj, Set.of("repeat", "level", "rows"), what);
        return new SectionNode(repeat, level, members, info);
    }

    private List<SectionMember> members(ConfigList values) throws CompilationException {
        List<SectionMember> members = new ArrayList<>();
        for (ConfigValue value : values) {
            ConfigObject obj = object(value, "header or footer member");
            members.add(obj.containsKey("cells") ? row(obj) : cell(obj));
        }
        return members;
    }

    private RowNode row(ConfigObject obj) throws CompilationException {
        List<CellNode> cells = new ArrayList<>();
        for (ConfigValue value : optionalList(obj.get("cells"), "cells")) {
            cells.add(cell(object(value, "cell")));
        }
        warnUnknown(obj, union(Set.of("cells"), ROW_PROPERTIES), "row");
        return new RowNode(attributes(obj, ROW_PROPERTIES), cells, info(obj));
    }

    private CellNode cell(ConfigObject obj) throws CompilationException {
        warnUnknown(obj, union(CELL_KEYS, CELL_PROPERTIES), "cell");
        return new CellNode(
                optionalInteger(obj, "x"),
                optionalInteger(obj, "y"),
                optionalInteger(obj, "colspan"),
                optionalInteger(obj, "rowspan"),
                attributes(obj, CELL_PROPERTIES),
                items(obj.get("content"), "content"),
                info(obj));
    }

    private List<ItemNode> items(ConfigValue value, String key) throws CompilationException {
        List<ItemNode> items = new ArrayList<>();
        for (ConfigValue element : optionalList(value, key)) {
            items.add(item(object(element, "content item")));
        }
        return items;
    }

    private ItemNode item(ConfigObject obj) throws CompilationException {
        SourceInfo info = info(obj);
        ConfigValue typeValue = obj.get("type");
        if (typeValue != null && typeValue.valueType() == ConfigValueType.STRING
                && !obj.containsKey("text") && !obj.containsKey("source")) {
            Optional<LayoutKind> kind = LayoutKind.fromKeyword((String) typeValue.unwrapped());
            if (kind.isPresent()) {
                LayoutNode nested = layout(kind.get(), obj, info);
                return ItemNode.nested(nested);
            }
        }
        warnUnknown(obj, ITEM_KEYS, "content item");
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (String key : new TreeMap<>(obj).keySet()) {
            attributes.put(key, raw(obj.get(key)));
        }
        return new ItemNode(attributes, null, info);
    }

    private LineNode line(ConfigObject obj) throws CompilationException {
        SourceInfo info = info(obj);
        boolean hasX = obj.containsKey("x");
        boolean hasY = obj.containsKey("y");
        if (hasX == hasY) {
            throw new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION,
                    "A line must declare exactly one of 'x' (vertical) or 'y' (horizontal)", obj.unwrapped(), info);
        }
        warnUnknown(obj, LINE_KEYS, "line");
        int position = hasY ? integer(obj.get("y"), "y") : integer(obj.get("x"), "x");
        return new LineNode(hasY, position,
                optionalInteger(obj, "start"),
                optionalInteger(obj, "end"),
                obj.containsKey("stroke") ? raw(obj.get("stroke")) : null,
                info);
    }

    private Map<String, Object> attributes(ConfigObject obj, Set<String> keys) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (String key : new TreeMap<>(obj).keySet()) {
            if (keys.contains(key)) {
                attributes.put(key, raw(obj.get(key)));
            }
        }
        return attributes;
    }

    private Object raw(ConfigValue value) {
        if (value instanceof ConfigObject obj) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : new TreeMap<>(obj).keySet()) {
                map.put(key, raw(obj.get(key)));
            }
            return map;
        }
        if (value instanceof ConfigList list) {
            List<Object> out = new ArrayList<>(list.size());
            for (ConfigValue element : list) {
                out.add(raw(element));
            }
            return out;
        }
        return value.unwrapped();
    }

    private void warnUnknown(ConfigObject obj, Set<String> known, String what) {
        for (String key : new TreeMap<>(obj).keySet()) {
            if (!known.contains(key)) {
                diagnostics.reportWarning("Unknown key '" + key + "' in " + what + " is ignored", info(obj.get(key)));
            }
        }
    }

    private ConfigObject object(ConfigValue value, String what) throws CompilationException {
        if (value instanceof ConfigObject obj) {
            return obj;
        }
        throw mismatch(value, what, "an object");
    }

    private ConfigList list(ConfigValue value, String what) throws CompilationException {
        if (value instanceof ConfigList list) {
            return list;
        }
        throw mismatch(value, what, "a list");
    }

    private List<ConfigValue> optionalList(ConfigValue value, String what) throws CompilationException {
        if (value == null || value.valueType() == ConfigValueType.NULL) {
            return List.of();
        }
        return list(value, what);
    }

    private Integer optionalInteger(ConfigObject obj, String key) throws CompilationException {
        ConfigValue value = obj.get(key);
        if (value == null || value.valueType() == ConfigValueType.NULL) {
            return null;
        }
        return integer(value, key);
    }

    private int integer(ConfigValue value, String what) throws CompilationException {
        if (value.unwrapped() instanceof Integer i) {
            return i;
        }
        throw mismatch(value, what, "an integer");
    }

    private boolean bool(ConfigValue value, String what) throws CompilationException {
        if (value.unwrapped() instanceof Boolean b) {
            return b;
        }
        throw mismatch(value, what, "a boolean");
    }

    private String string(ConfigValue value, String what) throws CompilationException {
        if (value.valueType() == ConfigValueType.STRING) {
            return (String) value.unwrapped();
        }
        throw mismatch(value, what, "a string");
    }

    private CompilationException mismatch(ConfigValue value, String what, String expected) {
        return new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION,
                "Expected " + what + " to be " + expected + " but found " + value.valueType().name().toLowerCase(Locale.ROOT),
                value.unwrapped(), info(value));
    }

    private static CompilationException wrap(ConfigException e) {
        return new CompilationException(CompilerErrorCode.INVALID_LAYOUT_DEFINITION, e.getMessage(), e);
    }

    private SourceInfo info(ConfigValue value) {
        return new SourceInfo(fileName, value.origin().lineNumber());
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new HashSet<>(a);
        all.addAll(b);
        return all;
    }

    private static String defaultName(String fileName) {
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
