package com.componenttrace.agent;

import com.componenttrace.core.config.TracerConfig;
import com.componenttrace.core.config.TracerConfigReader;
import com.componenttrace.core.session.TracerSessions;
import com.componenttrace.core.timeline.RingBufferTimelineRecorder;
import com.github.benmanes.caffeine.cache.Ticker;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.utility.JavaModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.instrument.Instrumentation;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the host application JVM via:
 *   java -javaagent:tracer-agent-java.jar=output=/path/to/output,component_type=org.host.Component,renderer_type=org.host.Renderer -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   output         directory where timeline.json is written (default: java.io.tmpdir)
 *   namespace      class name prefix of enhanced components; overrides the config file
 *   config         path of a component-tracer.json file (default: classpath resource)
 *   component_type fully-qualified base type of host components (required to instrument)
 *   renderer_type  fully-qualified host renderer type
 *   record         "true"/"false", start recording at boot (default: true)
 */
public class AgentBootstrap {

    private static final Logger log = LoggerFactory.getLogger(AgentBootstrap.class);

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        install(agentArgs, instrumentation, false);
    }

    /** Called when agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        install(agentArgs, instrumentation, true);
    }

    static void install(String agentArgs, Instrumentation instrumentation, boolean retransform) {
        AgentConfig agentConfig = parseArgs(agentArgs);
        TracerConfig config = loadConfig(agentConfig);
        log.info("Tracing components of {} (renderer {}), enhanced namespace '{}'",
            agentConfig.componentType(), agentConfig.rendererType(), config.getEnhancedNamespace());

        HostBinding binding = HostBinding.defaults(agentConfig.componentType(), agentConfig.rendererType());
        TracerSessions sessions = createSessions(config, binding);
        if (agentConfig.record() || config.isRecordOnStart()) {
            sessions.recorder().startRecording();
        }
        AgentHooks.install(sessions, binding);

        // Register shutdown hook first so it fires even if instrumentation fails
        Path dumpPath = Paths.get(agentConfig.outputPath(), "timeline.json");
        Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(dumpPath, sessions)));

        if (!binding.isBound()) {
            log.warn("No component_type given; lifecycle instrumentation disabled");
            return;
        }

        AgentBuilder agentBuilder = new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    log.warn("Transform error for {}", typeName, throwable);
                }
            })
            .ignore(nameStartsWith("com.componenttrace.").or(nameStartsWith("net.bytebuddy.")));
        if (retransform) {
            agentBuilder = agentBuilder
                .disableClassFormatChanges()
                .with(AgentBuilder.RedefinitionStrategy.RETRANSFORMATION);
        }

        AgentBuilder.Identified.Extendable extendable = agentBuilder
            .type(hasSuperType(named(binding.componentType())).and(not(isInterface())))
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                HostInstrumentation.component(builder, binding));
        if (binding.rendererType() != null && !binding.rendererType().isBlank()) {
            extendable = extendable
                .type(hasSuperType(named(binding.rendererType())).and(not(isInterface())))
                .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                    HostInstrumentation.renderer(builder, binding));
        } else {
            log.warn("No renderer_type given; components will not be assigned to sessions");
        }
        extendable.installOn(instrumentation);

        log.info("Instrumentation installed");
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    static TracerConfig loadConfig(AgentConfig agentConfig) {
        TracerConfigReader reader = new TracerConfigReader();
        TracerConfig config;
        try {
            config = agentConfig.configPath() != null
                ? reader.read(Path.of(agentConfig.configPath()))
                : reader.readClasspath(TracerConfigReader.DEFAULT_RESOURCE, AgentBootstrap.class.getClassLoader());
        } catch (TracerConfigReader.ConfigReadException e) {
            log.warn("Falling back to default tracer config: {}", e.getMessage());
            config = TracerConfig.defaults();
        }
        return agentConfig.namespace() != null ? config.withEnhancedNamespace(agentConfig.namespace()) : config;
    }

    static TracerSessions createSessions(TracerConfig config, HostBinding binding) {
        RingBufferTimelineRecorder recorder = new RingBufferTimelineRecorder(
            config.getMaxEvents(), config.getMaxBatches(), Ticker.systemTicker(), Clock.systemUTC());
        return new TracerSessions(recorder, config, null, Ticker.systemTicker(), Clock.systemUTC(),
            binding.parameterReader());
    }

    static AgentConfig parseArgs(String agentArgs) {
        String outputPath = System.getProperty("java.io.tmpdir");
        String namespace = null;
        String configPath = null;
        String componentType = null;
        String rendererType = null;
        boolean record = true;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    String value = kv[1].trim();
                    switch (kv[0].trim()) {
                        case "output"         -> outputPath    = value;
                        case "namespace"      -> namespace     = value;
                        case "config"         -> configPath    = value;
                        case "component_type" -> componentType = value;
                        case "renderer_type"  -> rendererType  = value;
                        case "record"         -> record        = !"false".equalsIgnoreCase(value);
                        default -> log.warn("Ignoring unknown agent argument: {}", kv[0].trim());
                    }
                }
            }
        }
        return new AgentConfig(outputPath, namespace, configPath, componentType, rendererType, record);
    }

    record AgentConfig(
        String outputPath,
        String namespace,
        String configPath,
        String componentType,
        String rendererType,
        boolean record
    ) {}
}
