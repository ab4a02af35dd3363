/*
 * Copyright 2015 Netflix, Inc.
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

package com.netflix.ledgersched.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 digests over a canonical JSON form, with object properties and map keys in sorted order, so that the
 * same content always hashes to the same value.
 */
final class LedgerHashing {

    static final String GENESIS_PREVIOUS_HASH = "0".repeat(64);
    static final String EMPTY_BLOCK_SEED = "empty_block";

    private static final String ALGORITHM = "SHA-256";
    private static final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
    private static final TypeReference<TreeMap<String, Object>> FIELDS_TYPE = new TypeReference<TreeMap<String, Object>>() {
    };

    private LedgerHashing() {
    }

    static String sha256Hex(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    /**
     * Hash a transaction's content. The block hash stamped on it is left out, as it is derived from this hash.
     */
    static String hashTransaction(SchedulingTransaction transaction) {
        Map<String, Object> fields = canonicalMapper.convertValue(transaction, FIELDS_TYPE);
        fields.remove("blockHash");
        return sha256Hex(canonicalJson(fields));
    }

    static String hashBlockHeader(long blockId, long timestamp, String previousHash, String merkleRoot, int transactionCount) {
        Map<String, Object> header = new TreeMap<>();
        header.put("blockId", blockId);
        header.put("timestamp", timestamp);
        header.put("previousHash", previousHash);
        header.put("merkleRoot", merkleRoot);
        header.put("transactionCount", transactionCount);
        return sha256Hex(canonicalJson(header));
    }

    private static String canonicalJson(Object value) {
        try {
            return canonicalMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("Can't write canonical form of " + value, e);
        }
    }
}
