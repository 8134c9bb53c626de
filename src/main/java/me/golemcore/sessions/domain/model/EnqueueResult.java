package me.golemcore.sessions.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Outcome of queueing a message: either its 0-based queue position or an
 * error.
 */
public record EnqueueResult(Integer position, String error) {

    public static EnqueueResult accepted(int position) {
        return new EnqueueResult(position, null);
    }

    public static EnqueueResult rejected(String error) {
        return new EnqueueResult(null, error);
    }

    public boolean isAccepted() {
        return error == null;
    }
}
