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

import org.descriptorj.crypto.HDDerivationException;

import javax.annotation.Nullable;

/**
 * Thrown when scripts cannot be produced from a descriptor: a key could not be derived, or the descriptor still
 * has wildcards or multipath steps that must be resolved first.
 */
public class DescriptorDerivationException extends DescriptorException {
    public DescriptorDerivationException(String message) {
        super(message);
    }

    public DescriptorDerivationException(String message, HDDerivationException cause) {
        super(message, -1, cause);
    }

    /** Returns the reason reported by the key derivation, or null if the failure did not come from it. */
    @Nullable
    public HDDerivationException.Reason getReason() {
        return getCause() instanceof HDDerivationException ? ((HDDerivationException) getCause()).getReason() : null;
    }
}
