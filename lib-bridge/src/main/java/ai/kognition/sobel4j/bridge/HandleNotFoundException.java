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


package ai.kognition.sobel4j.bridge;

import ai.kognition.sobel4j.image.SobelException;

/**
 * Thrown when a handle doesn't refer to a live filter, either because it was never
 * issued or because it has been destroyed.
 */
public class HandleNotFoundException extends SobelException {
    private static final long serialVersionUID = 1L;

    public HandleNotFoundException(final long handle) {
        super("No live filter has the handle " + handle);
    }
}
