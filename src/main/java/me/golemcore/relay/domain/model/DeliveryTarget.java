package me.golemcore.relay.domain.model;

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
 * The ledger row a delivery attempt updates: the message itself for a direct
 * send, or one {@link MessageDelivery} row for a group fan-out.
 */
public record DeliveryTarget(Kind kind, String messageId, String deliveryId) {

    public enum Kind {
        MESSAGE, DELIVERY
    }

    public static DeliveryTarget message(String messageId) {
        return new DeliveryTarget(Kind.MESSAGE, messageId, null);
    }

    public static DeliveryTarget delivery(String messageId, String deliveryId) {
        return new DeliveryTarget(Kind.DELIVERY, messageId, deliveryId);
    }

    public boolean isFanOut() {
        return kind == Kind.DELIVERY;
    }

    public String recordId() {
        return isFanOut() ? deliveryId : messageId;
    }

    public String key() {
        return kind.name() + ":" + recordId();
    }
}
