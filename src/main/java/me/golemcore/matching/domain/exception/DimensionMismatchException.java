package me.golemcore.matching.domain.exception;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Thrown when two vectors of different dimension are compared.
 *
 * <p>
 * A mismatch means the inputs were produced by different embedding models (or
 * were truncated), so any similarity computed from them would be meaningless.
 * The detailed evaluation wraps it in a {@link MatchEvaluationException} that
 * names the failing score category.
 *
 * @since 1.0
 */
public class DimensionMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int leftDimension;
    private final int rightDimension;

    public DimensionMismatchException(int leftDimension, int rightDimension) {
        super("Vectors must have same length: " + leftDimension + " != " + rightDimension);
        this.leftDimension = leftDimension;
        this.rightDimension = rightDimension;
    }

    public int getLeftDimension() {
        return leftDimension;
    }

    public int getRightDimension() {
        return rightDimension;
    }
}
