package dev.mars.spacetime.algebra.eval;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import java.util.Comparator;
import java.util.List;

/**
 * Value of an evaluated expression: a list of working maps ordered by start
 * time, or a scalar command fragment such as a number or {@code null()}.
 */
public final class Operand {

    static final Comparator<AlgebraMap> BY_START =
        Comparator.comparingLong(map -> map.getTemporalExtent().startOrdinal());

    private final List<AlgebraMap> maps;
    private final String scalar;

    private Operand(List<AlgebraMap> maps, String scalar) {
        this.maps = maps;
        this.scalar = scalar;
    }

    public static Operand maps(List<AlgebraMap> maps) {
        return new Operand(maps.stream().sorted(BY_START).toList(), null);
    }

    public static Operand scalar(String text) {
        return new Operand(null, text);
    }

    public boolean isScalar() {
        return scalar != null;
    }

    public List<AlgebraMap> getMaps() {
        if (maps == null) {
            throw new IllegalStateException("Scalar operand has no maps: " + scalar);
        }
        return maps;
    }

    public String getScalar() {
        return scalar;
    }
}
