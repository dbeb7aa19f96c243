/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.strata.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Test for {@link CheckpointMarker}. */
class CheckpointMarkerTest {

    @Test
    void testJsonContent() {
        CheckpointMarker marker = CheckpointMarker.create(1700000000000L);
        String json = marker.toJson();

        assertThat(json).contains("\"createTimeMillis\" : 1700000000000");
        assertThat(CheckpointMarker.fromContent(json)).isEqualTo(marker);
    }

    @Test
    void testUnknownFieldsIgnored() {
        CheckpointMarker marker =
                CheckpointMarker.fromContent(
                        "{\"version\":2,\"createTimeMillis\":5,\"writer\":\"rank-0\"}");
        assertThat(marker).isEqualTo(new CheckpointMarker(2, 5));
    }

    @Test
    void testLegacyContent() {
        assertThat(CheckpointMarker.fromContent("1")).isNull();
        assertThat(CheckpointMarker.fromContent("{broken")).isNull();
    }
}
