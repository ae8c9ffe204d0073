package io.commtrace.analysis.harness;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Service-loader registry of {@link SiblingDetector} implementations.
 *
 * <p>Detectors are matched by their {@link DetectorName} annotation, falling back to
 * {@link SiblingDetector#name()} for unannotated implementations. Every lookup returns a
 * new instance.
 */
public final class SiblingDetectorIO {

    private static final Logger logger = LogManager.getLogger(SiblingDetectorIO.class);

    private static final ServiceLoader<SiblingDetector> serviceLoader =
        ServiceLoader.load(SiblingDetector.class);

    private SiblingDetectorIO() {
    }

    /**
     * Gets a detector by name.
     *
     * @param name the detector name to find
     * @return a new instance of the detector, or empty if not found
     */
    public static Optional<SiblingDetector> get(String name) {
        return providers()
            .filter(provider -> name.equals(detectorName(provider)))
            .findFirst()
            .map(ServiceLoader.Provider::get);
    }

    /**
     * Gets all available detectors.
     *
     * @return new instances of every registered detector
     */
    public static List<SiblingDetector> getAll() {
        List<SiblingDetector> result = new ArrayList<>();
        providers().forEach(provider -> result.add(provider.get()));
        return result;
    }

    /**
     * @return the names of all available detectors
     */
    public static List<String> getAvailableNames() {
        List<String> names = new ArrayList<>();
        providers().forEach(provider -> {
            String name = detectorName(provider);
            if (name != null) {
                names.add(name);
            }
        });
        return names;
    }

    public static boolean isAvailable(String name) {
        return providers().anyMatch(provider -> name.equals(detectorName(provider)));
    }

    /**
     * Reloads the service loader to pick up detectors added at runtime.
     */
    public static void reload() {
        serviceLoader.reload();
    }

    private static Stream<ServiceLoader.Provider<SiblingDetector>> providers() {
        return serviceLoader.stream();
    }

    private static String detectorName(ServiceLoader.Provider<SiblingDetector> provider) {
        DetectorName annotation = provider.type().getAnnotation(DetectorName.class);
        if (annotation != null) {
            return annotation.value();
        }
        try {
            return provider.get().name();
        } catch (RuntimeException e) {
            logger.warn("Cannot instantiate detector {}: {}", provider.type().getName(), e.getMessage());
            return null;
        }
    }
}
