/*
 * Copyright by the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.descriptorj.descriptor;

/**
 * Base class for everything that can go wrong while parsing, validating or evaluating an output script descriptor.
 * When the problem can be attributed to a place in the input, {@link #getOffset()} is the zero-based character
 * offset of that place; otherwise it is -1.
 */
public class DescriptorException extends Exception {
    private final int offset;

    public DescriptorException(String message) {
        this(message, -1);
    }

    public DescriptorException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    public DescriptorException(String message, int offset, Throwable cause) {
        super(message, cause);
        this.offset = offset;
    }

    /** Returns the character offset in the input the error refers to, or -1 if it has none. */
    public int getOffset() {
        return offset;
    }

    @Override
    public String getMessage() {
        return offset >= 0 ? super.getMessage() + " (at offset " + offset + ")" : super.getMessage();
    }
}
