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
 * Thrown when a key, fingerprint, address or hex payload inside a descriptor cannot be decoded.
 */
public class KeyEncodingException extends DescriptorException {
    public KeyEncodingException(String message, int offset) {
        super(message, offset);
    }

    public KeyEncodingException(String message, int offset, Throwable cause) {
        super(message, offset, cause);
    }
}
