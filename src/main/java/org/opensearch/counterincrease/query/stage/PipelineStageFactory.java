/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.counterincrease.query.stage;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.counterincrease.lang.prom.stage.IncreaseStage;
import org.opensearch.counterincrease.lang.prom.stage.RateStage;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Factory creating pipeline stages by name.
 *
 * <p>Every stage class listed in {@link #STAGE_CLASSES} is registered under the name of its
 * {@link PipelineStageAnnotation}. Its static {@code fromArgs(Map)} and {@code readFrom(StreamInput)}
 * methods are resolved once, at class initialization, so a malformed stage fails fast.</p>
 *
 * <p>On the wire a stage is written as its name followed by its own payload, see
 * {@link #writeTo(StreamOutput, PipelineStage)} and {@link #readFrom(StreamInput)}.</p>
 */
public final class PipelineStageFactory {

    private static final Logger logger = LogManager.getLogger(PipelineStageFactory.class);

    private static final List<Class<? extends PipelineStage>> STAGE_CLASSES = List.of(IncreaseStage.class, RateStage.class);

    private static final Map<String, Registration> REGISTRY;

    static {
        Map<String, Registration> registry = new TreeMap<>();
        for (Class<? extends PipelineStage> stageClass : STAGE_CLASSES) {
            Registration registration = Registration.of(stageClass);
            if (registry.putIfAbsent(registration.name(), registration) != null) {
                throw new IllegalStateException("Duplicate pipeline stage name [" + registration.name() + "]");
            }
        }
        REGISTRY = Map.copyOf(registry);
        logger.debug("Registered pipeline stages: {}", REGISTRY.keySet());
    }

    private PipelineStageFactory() {}

    /**
     * Create a stage from its name and argument map.
     *
     * @param stageType the registered stage name
     * @param args stage arguments
     * @return the stage
     * @throws IllegalArgumentException if the name is unknown or the arguments are invalid
     */
    public static PipelineStage createWithArgs(String stageType, Map<String, Object> args) {
        Registration registration = lookup(stageType);
        try {
            return (PipelineStage) registration.fromArgs().invoke(null, args);
        } catch (InvocationTargetException e) {
            throw rethrow(stageType, e.getCause());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot access fromArgs of stage [" + stageType + "]", e);
        }
    }

    /**
     * Read a stage written by {@link #writeTo(StreamOutput, PipelineStage)}.
     *
     * @param in the input stream
     * @return the stage
     * @throws IOException if an I/O error occurs
     */
    public static PipelineStage readFrom(StreamInput in) throws IOException {
        String stageType = in.readString();
        Registration registration = lookup(stageType);
        try {
            return (PipelineStage) registration.readFrom().invoke(null, in);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof IOException ioException) {
                throw ioException;
            }
            throw rethrow(stageType, e.getCause());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot access readFrom of stage [" + stageType + "]", e);
        }
    }

    /**
     * Write a stage preceded by its name.
     *
     * @param out the output stream
     * @param stage the stage
     * @throws IOException if an I/O error occurs
     */
    public static void writeTo(StreamOutput out, PipelineStage stage) throws IOException {
        out.writeString(stage.getName());
        stage.writeTo(out);
    }

    /**
     * @return names of all registered stages
     */
    public static Set<String> getSupportedStageTypes() {
        return REGISTRY.keySet();
    }

    /**
     * @param stageType a stage name
     * @return true if a stage is registered under that name
     */
    public static boolean isStageTypeSupported(String stageType) {
        return stageType != null && REGISTRY.containsKey(stageType);
    }

    private static Registration lookup(String stageType) {
        if (stageType == null || stageType.isEmpty()) {
            throw new IllegalArgumentException("Stage type cannot be null or empty");
        }
        Registration registration = REGISTRY.get(stageType);
        if (registration == null) {
            throw new IllegalArgumentException("Unknown stage type: " + stageType + ", supported: " + REGISTRY.keySet());
        }
        return registration;
    }

    private static RuntimeException rethrow(String stageType, Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new IllegalArgumentException("Failed to create stage [" + stageType + "]", cause);
    }

    private record Registration(String name, Method fromArgs, Method readFrom) {

        static Registration of(Class<? extends PipelineStage> stageClass) {
            PipelineStageAnnotation annotation = stageClass.getAnnotation(PipelineStageAnnotation.class);
            if (annotation == null) {
                throw new IllegalStateException(stageClass.getName() + " is not annotated with @PipelineStageAnnotation");
            }
            try {
                Method fromArgs = stageClass.getMethod("fromArgs", Map.class);
                Method readFrom = stageClass.getMethod("readFrom", StreamInput.class);
                if (Modifier.isStatic(fromArgs.getModifiers()) == false || Modifier.isStatic(readFrom.getModifiers()) == false) {
                    throw new IllegalStateException(stageClass.getName() + " must declare static fromArgs and readFrom methods");
                }
                return new Registration(annotation.name(), fromArgs, readFrom);
            } catch (NoSuchMethodException e) {
                throw new IllegalStateException(stageClass.getName() + " must declare static fromArgs and readFrom methods", e);
            }
        }
    }
}
