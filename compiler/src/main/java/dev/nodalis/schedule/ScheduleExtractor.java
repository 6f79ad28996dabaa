package dev.nodalis.schedule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.nodalis.st.ast.CompilationUnit;
import dev.nodalis.st.ast.ProgramDeclaration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the directive comments of a Structured Text source line by line:
 * <ul>
 *   <li>{@code //Task={"Name":"Fast","Interval":2,"Priority":1}}</li>
 *   <li>{@code //Instance={"TypeName":"Pump","Name":"Pump1","AssociatedTaskName":"Fast"}}</li>
 *   <li>{@code //Map=<opaque payload>}</li>
 *   <li>{@code //Global={"Name":"Temp1","Address":"40001"}}, also after code on the same line</li>
 * </ul>
 * and collects {@code PROGRAM} names independently of the parser. Instances
 * are resolved against tasks once the whole text has been read. Given the
 * parsed unit, scanned names the unit does not declare (a program inside a
 * block comment, say) are dropped with a diagnostic.
 */
public final class ScheduleExtractor {

    private static final Logger logger = LogManager.getLogger(ScheduleExtractor.class);

    static final String TASK_PREFIX = "//Task=";
    static final String INSTANCE_PREFIX = "//Instance=";
    static final String MAP_PREFIX = "//Map=";
    static final String GLOBAL_MARKER = "//Global=";

    private static final Pattern PROGRAM_PATTERN =
            Pattern.compile("^\\s*PROGRAM\\s+([A-Za-z_][A-Za-z0-9_]*)", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper mapper;

    public ScheduleExtractor() {
        this(new ObjectMapper());
    }

    public ScheduleExtractor(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public SchedulingModel extract(String sourceText) {
        return extract(sourceText, null);
    }

    public SchedulingModel extract(String sourceText, CompilationUnit unit) {
        Objects.requireNonNull(sourceText, "sourceText");
        Set<String> declared = unit == null ? null : declaredPrograms(unit);

        Map<String, TaskPayload> tasks = new LinkedHashMap<>();
        Map<String, Long> intervals = new LinkedHashMap<>();
        List<PendingInstance> pending = new ArrayList<>();
        List<String> ioMaps = new ArrayList<>();
        List<GlobalBinding> globals = new ArrayList<>();
        List<String> programs = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        String[] lines = sourceText.split("\\r?\\n", -1);
        for (int index = 0; index < lines.length; index++) {
            int lineNumber = index + 1;
            String line = lines[index];
            String trimmed = line.trim();

            if (trimmed.startsWith(TASK_PREFIX)) {
                TaskPayload task = read(payloadOf(trimmed, TASK_PREFIX), TaskPayload.class, lineNumber, diagnostics);
                if (task == null) {
                    continue;
                }
                if (isBlank(task.name)) {
                    diagnostics.add(new Diagnostic(Diagnostic.Kind.MALFORMED_DIRECTIVE, lineNumber,
                            "task directive without a Name"));
                    continue;
                }
                Long interval = parseInterval(task.interval);
                if (interval == null || interval <= 0) {
                    diagnostics.add(new Diagnostic(Diagnostic.Kind.INVALID_INTERVAL, lineNumber,
                            "task " + task.name + " has interval " + task.interval + ", expected a positive integer"));
                    continue;
                }
                if (tasks.containsKey(task.name)) {
                    diagnostics.add(new Diagnostic(Diagnostic.Kind.DUPLICATE_TASK, lineNumber,
                            "task " + task.name + " is already declared"));
                    continue;
                }
                tasks.put(task.name, task);
                intervals.put(task.name, interval);
                logger.debug("line {}: task {} every {} tick(s)", lineNumber, task.name, interval);
            } else if (trimmed.startsWith(INSTANCE_PREFIX)) {
                InstancePayload instance = read(payloadOf(trimmed, INSTANCE_PREFIX), InstancePayload.class,
                        lineNumber, diagnostics);
                if (instance == null) {
                    continue;
                }
                if (isBlank(instance.typeName) || isBlank(instance.associatedTaskName)) {
                    diagnostics.add(new Diagnostic(Diagnostic.Kind.MALFORMED_DIRECTIVE, lineNumber,
                            "instance directive needs TypeName and AssociatedTaskName"));
                    continue;
                }
                pending.add(new PendingInstance(lineNumber,
                        new ProgramInstance(instance.typeName, instance.name, instance.associatedTaskName)));
            } else if (trimmed.startsWith(MAP_PREFIX)) {
                String payload = payloadOf(trimmed, MAP_PREFIX);
                ioMaps.add(payload);
                logger.debug("line {}: I/O map {}", lineNumber, payload);
            } else if (line.contains(GLOBAL_MARKER)) {
                String payload = line.substring(line.indexOf(GLOBAL_MARKER) + GLOBAL_MARKER.length()).trim();
                GlobalPayload global = read(payload, GlobalPayload.class, lineNumber, diagnostics);
                if (global == null) {
                    continue;
                }
                if (isBlank(global.name) || isBlank(global.address)) {
                    diagnostics.add(new Diagnostic(Diagnostic.Kind.MALFORMED_DIRECTIVE, lineNumber,
                            "global directive needs a Name and a non-empty Address"));
                    continue;
                }
                globals.add(new GlobalBinding(global.name, global.address));
                logger.debug("line {}: global {} at {}", lineNumber, global.name, global.address);
            } else {
                Matcher matcher = PROGRAM_PATTERN.matcher(line);
                if (matcher.find()) {
                    String program = matcher.group(1);
                    if (declared == null || declared.contains(program.toUpperCase(Locale.ROOT))) {
                        programs.add(program);
                    } else {
                        diagnostics.add(new Diagnostic(Diagnostic.Kind.UNDECLARED_PROGRAM, lineNumber,
                                "PROGRAM " + program + " is not declared in the parsed source, not scheduled"));
                    }
                }
            }
        }

        Map<String, List<ProgramInstance>> instancesByTask = new LinkedHashMap<>();
        for (String name : tasks.keySet()) {
            instancesByTask.put(name, new ArrayList<>());
        }
        for (PendingInstance instance : pending) {
            List<ProgramInstance> owner = instancesByTask.get(instance.instance.getTaskName());
            if (owner == null) {
                diagnostics.add(new Diagnostic(Diagnostic.Kind.UNRESOLVED_TASK_REFERENCE, instance.line,
                        "instance of " + instance.instance.getTypeName() + " refers to unknown task "
                                + instance.instance.getTaskName()));
                continue;
            }
            owner.add(instance.instance);
        }

        List<TaskDefinition> definitions = new ArrayList<>();
        for (Map.Entry<String, TaskPayload> entry : tasks.entrySet()) {
            definitions.add(new TaskDefinition(entry.getKey(), intervals.get(entry.getKey()),
                    parsePriority(entry.getValue().priority), instancesByTask.get(entry.getKey())));
        }

        for (Diagnostic diagnostic : diagnostics) {
            logger.warn("{}", diagnostic);
        }
        return new SchedulingModel(definitions, ioMaps, globals, programs, diagnostics);
    }

    private static Set<String> declaredPrograms(CompilationUnit unit) {
        Set<String> names = new HashSet<>();
        for (ProgramDeclaration program : unit.getPrograms()) {
            names.add(program.getName().toUpperCase(Locale.ROOT));
        }
        return names;
    }

    private <T> T read(String payload, Class<T> type, int line, List<Diagnostic> diagnostics) {
        try {
            T value = mapper.readValue(payload, type);
            if (value == null) {
                diagnostics.add(new Diagnostic(Diagnostic.Kind.MALFORMED_DIRECTIVE, line, "empty directive payload"));
            }
            return value;
        } catch (JsonProcessingException e) {
            diagnostics.add(new Diagnostic(Diagnostic.Kind.MALFORMED_DIRECTIVE, line,
                    "unreadable directive payload: " + e.getOriginalMessage()));
            return null;
        }
    }

    private static String payloadOf(String trimmedLine, String prefix) {
        return trimmedLine.substring(prefix.length()).trim();
    }

    private static Long parseInterval(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Integer parsePriority(JsonNode node) {
        Long value = parseInterval(node);
        if (value == null || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            return null;
        }
        return value.intValue();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class PendingInstance {
        final int line;
        final ProgramInstance instance;

        PendingInstance(int line, ProgramInstance instance) {
            this.line = line;
            this.instance = instance;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class TaskPayload {
        @JsonProperty("Name")
        String name;
        @JsonProperty("Interval")
        JsonNode interval;
        @JsonProperty("Priority")
        JsonNode priority;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class InstancePayload {
        @JsonProperty("TypeName")
        String typeName;
        @JsonProperty("Name")
        String name;
        @JsonProperty("AssociatedTaskName")
        String associatedTaskName;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class GlobalPayload {
        @JsonProperty("Name")
        String name;
        @JsonProperty("Address")
        String address;
    }
}
