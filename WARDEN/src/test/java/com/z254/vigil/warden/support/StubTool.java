package com.z254.vigil.warden.support;

import com.z254.vigil.warden.domain.model.SafetyLevel;
import com.z254.vigil.warden.tool.RemediationTool;
import com.z254.vigil.warden.tool.ToolContext;
import com.z254.vigil.warden.tool.ToolMetadata;
import com.z254.vigil.warden.tool.ToolResult;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Scriptable tool that records every execution it receives.
 */
public class StubTool implements RemediationTool {

    private final ToolMetadata metadata;
    private final Function<ToolContext, Mono<ToolResult>> behaviour;
    private final ValidationResult validation;
    private final List<ToolContext> executions = new CopyOnWriteArrayList<>();

    private StubTool(ToolMetadata metadata, Function<ToolContext, Mono<ToolResult>> behaviour,
                     ValidationResult validation) {
        this.metadata = metadata;
        this.behaviour = behaviour;
        this.validation = validation;
    }

    public static StubTool succeeding(String name) {
        return new StubTool(metadata(name, Duration.ofSeconds(5), 1, true),
                ctx -> Mono.just(ToolResult.success(name, "done")), ValidationResult.success());
    }

    public static StubTool failing(String name) {
        return new StubTool(metadata(name, Duration.ofSeconds(5), 1, true),
                ctx -> Mono.just(ToolResult.failure(name, "BOOM", "target refused")), ValidationResult.success());
    }

    public static StubTool throwing(String name) {
        return new StubTool(metadata(name, Duration.ofSeconds(5), 1, true),
                ctx -> Mono.error(new IllegalStateException("connector down")), ValidationResult.success());
    }

    public static StubTool hanging(String name, Duration timeout) {
        return new StubTool(metadata(name, timeout, 1, true),
                ctx -> Mono.never(), ValidationResult.success());
    }

    public static StubTool rejecting(String name, String message) {
        return new StubTool(metadata(name, Duration.ofSeconds(5), 1, true),
                ctx -> Mono.just(ToolResult.success(name, "done")), ValidationResult.failure(message));
    }

    public static StubTool unsafeDuringBusinessHours(String name) {
        return new StubTool(metadata(name, Duration.ofSeconds(5), 1, false),
                ctx -> Mono.just(ToolResult.success(name, "done")), ValidationResult.success());
    }

    public static StubTool withBlastRadius(String name, int blastRadius) {
        return new StubTool(metadata(name, Duration.ofSeconds(5), blastRadius, true),
                ctx -> Mono.just(ToolResult.success(name, "done")), ValidationResult.success());
    }

    private static ToolMetadata metadata(String name, Duration timeout, int blastRadius, boolean safe) {
        return ToolMetadata.builder()
                .name(name)
                .description("stub " + name)
                .safetyLevel(SafetyLevel.LOW)
                .timeout(timeout)
                .defaultBlastRadius(blastRadius)
                .safeForBusinessHours(safe)
                .build();
    }

    @Override
    public ToolMetadata getMetadata() {
        return metadata;
    }

    @Override
    public Mono<ValidationResult> validate(ToolContext context) {
        return Mono.just(validation);
    }

    @Override
    public Mono<ToolResult> execute(ToolContext context) {
        return Mono.defer(() -> {
            executions.add(context);
            return behaviour.apply(context);
        });
    }

    public List<ToolContext> getExecutions() {
        return executions;
    }

    public int executionCount() {
        return executions.size();
    }
}
