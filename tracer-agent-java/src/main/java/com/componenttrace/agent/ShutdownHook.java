package com.componenttrace.agent;

import com.componenttrace.core.inspector.InspectorViews.RankingView;
import com.componenttrace.core.inspector.InspectorViews.RecordingStateView;
import com.componenttrace.core.inspector.InspectorViews.RenderBatchView;
import com.componenttrace.core.inspector.InspectorViews.TimelineEventView;
import com.componenttrace.core.session.TracerSession;
import com.componenttrace.core.session.TracerSessions;
import com.componenttrace.core.timeline.TimelineRecorder;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * Serializes the shared timeline and every open session's components to timeline.json on JVM shutdown.
 * Registered via Runtime.getRuntime().addShutdownHook().
 */
public class ShutdownHook implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ShutdownHook.class);

    private final Path outputPath;
    private final TracerSessions sessions;

    public ShutdownHook(Path outputPath, TracerSessions sessions) {
        this.outputPath = outputPath;
        this.sessions = sessions;
    }

    @Override
    public void run() {
        try {
            TimelineDump dump = buildDump();
            write(dump);
        } catch (IOException | RuntimeException e) {
            log.error("Failed writing {}", outputPath, e);
        }
    }

    TimelineDump buildDump() {
        TimelineRecorder recorder = sessions.recorder();
        TimelineDump dump = new TimelineDump();
        dump.recordingState = RecordingStateView.of(recorder.state());

        // Sessions sorted by id for determinism
        dump.sessions = sessions.sessions().stream()
            .sorted(Comparator.comparing(TracerSession::id))
            .map(session -> {
                TimelineDump.SessionDump s = new TimelineDump.SessionDump();
                s.sessionId = session.id();
                s.openedAt = session.openedAt().toString();
                s.counts = session.inspector().getCounts();
                s.components = session.inspector().getAllComponents();
                return s;
            })
            .collect(Collectors.toList());

        dump.events = TimelineEventView.of(recorder.events());
        dump.batches = recorder.batches().stream().map(RenderBatchView::of).collect(Collectors.toList());
        dump.ranking = recorder.rankedComponents().stream().map(RankingView::of).collect(Collectors.toList());
        return dump;
    }

    void write(TimelineDump dump) throws IOException {
        Files.createDirectories(outputPath.getParent() != null ? outputPath.getParent() : Path.of("."));
        try (Writer w = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            new GsonBuilder().setPrettyPrinting().create().toJson(dump, w);
        }
        log.info("timeline.json written: {}", outputPath);
    }
}
