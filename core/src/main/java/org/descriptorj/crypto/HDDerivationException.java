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


package org.descriptorj.crypto;

/**
 * Thrown when a BIP32 derivation step cannot be performed. The {@link Reason} tells callers whether the request
 * itself was impossible (hardened derivation without a private key, a path that is too deep or malformed) or
 * whether the derived key happened to be invalid.
 */
public class HDDerivationException extends RuntimeException {

    public enum Reason {
        /** A hardened child was requested from a key that has no private key. */
        HARDENED_FROM_PUBLIC,
        /** IL was not below the curve order, or the child key was zero or the point at infinity. */
        INVALID_CHILD_KEY,
        /** The path could not be parsed or would take the key deeper than 255 levels. */
        INVALID_PATH
    }

    private final Reason reason;

    public HDDerivationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public HDDerivationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
