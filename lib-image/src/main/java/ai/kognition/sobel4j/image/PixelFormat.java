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
 * The sample layouts a {@link RasterImage} can hold. Channels are interleaved and
 * multi-byte samples are little endian.
 */
public enum PixelFormat {
    GRAY8(1, 1),
    BGR8(3, 1),
    RGBA8(4, 1),
    GRAY16(1, 2);

    public final int channels;
    public final int bytesPerChannel;

    private PixelFormat(final int channels, final int bytesPerChannel) {
        this.channels = channels;
        this.bytesPerChannel = bytesPerChannel;
    }

    /**
     * Bytes occupied by one pixel.
     */
    public int elemSize() {
        return channels * bytesPerChannel;
    }

    public int depthBits() {
        return bytesPerChannel * 8;
    }
}
