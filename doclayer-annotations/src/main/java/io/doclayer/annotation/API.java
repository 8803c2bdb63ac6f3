/*
 * API.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.doclayer.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the stability of a public type, field, constructor or method of the Document Layer.
 *
 * <p>
 * Members inherit the status of their enclosing type unless they carry their own annotation. A status may be
 * raised (made more stable) at any time, but lowering it is only allowed at the boundaries described on each
 * {@link Status} value.
 * </p>
 *
 * <p>
 * Application code that maps its documents through the layer should only depend on {@link Status#MAINTAINED}
 * and {@link Status#STABLE} elements. Driver implementations additionally rely on {@link Status#UNSTABLE}
 * members of the driver contract.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that another package of the layer can reach it. May change in any release.
         */
        INTERNAL,

        /**
         * Scheduled for removal. May disappear in the next minor release.
         */
        DEPRECATED,

        /**
         * New and still being shaped. May change or be removed without notice.
         */
        EXPERIMENTAL,

        /**
         * May change incompatibly in the next minor release, but not before.
         */
        UNSTABLE,

        /**
         * Kept backwards-compatible within a major release, but may become less stable in the next major release.
         */
        MAINTAINED,

        /**
         * Shall not change incompatibly or be removed until the next major release.
         */
        STABLE
    }
}
