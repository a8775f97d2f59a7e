/*
 * Copyright 2022 Jim Carroll
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

package ai.kognition.sobel4j.image;

/**
 * Thrown when an image handed to an operation is empty or isn't in a format the
 * operation supports.
 */
public class InvalidImageException extends SobelException {
    private static final long serialVersionUID = 1L;

    public InvalidImageException(final String details) {
        super("Invalid image: " + details);
    }

    public InvalidImageException(final String details, final Throwable cause) {
        super("Invalid image: " + details, cause);
    }
}
