/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.council.core.errors;

import lombok.Getter;

/**
 * Thrown by all council components. Carries a {@link CouncilError} so that callers can classify the failure using
 * {@link #getCategory()}.
 */
@Getter
public class CouncilException extends RuntimeException {
    private final transient CouncilError error;

    public CouncilException(CouncilError error) {
        super(error.getMessage());
        this.error = error;
    }

    public CouncilException(CouncilError error, Throwable cause) {
        super(error.getMessage(), cause);
        this.error = error;
    }

    public static CouncilException of(ErrorType errorType, Object... args) {
        return new CouncilException(CouncilError.error(errorType, args));
    }

    public static CouncilException invalidInput(String detail) {
        return of(ErrorType.INVALID_INPUT, detail);
    }

    public static CouncilException notFound(String detail) {
        return of(ErrorType.NOT_FOUND, detail);
    }

    public static CouncilException conflict(String detail) {
        return of(ErrorType.CONFLICT, detail);
    }

    public ErrorType getErrorType() {
        return error.getErrorType();
    }

    public ErrorCategory getCategory() {
        return error.getErrorType().getCategory();
    }
}
