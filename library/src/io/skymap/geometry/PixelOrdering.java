/*
 * Copyright 2026 The Skymap Authors.
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
package io.skymap.geometry;

import jsinterop.annotations.JsType;

/**
 * The two numbering schemes of a hierarchical pixelization. The choice affects only how indices map
 * to positions, never the geometry of the pixels.
 */
@JsType
public enum PixelOrdering {
  /** Pixels are numbered along iso-latitude rings, from north to south. */
  RING,
  /** Pixels are numbered hierarchically by interleaving the bits of their in-face coordinates. */
  NESTED
}
