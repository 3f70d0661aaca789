package me.personabot.adapter.inbound.discord;

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

import me.personabot.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.HexFormat;

/**
 * Verifies the Ed25519 signature Discord attaches to every interaction
 * webhook ({@code X-Signature-Ed25519} over timestamp + raw body).
 */
@Component
@Slf4j
public class DiscordSignatureVerifier {

    /** DER prefix turning a raw 32-byte Ed25519 key into an X.509 SubjectPublicKeyInfo. */
    private static final byte[] X509_ED25519_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");

    private final BotProperties properties;
    private final PublicKey publicKey;

    public DiscordSignatureVerifier(BotProperties properties) {
        this.properties = properties;
        this.publicKey = parsePublicKey(properties.getDiscord().getPublicKey());
    }

    public boolean verify(String signatureHex, String timestamp, byte[] body) {
        if (!properties.getDiscord().isVerifySignatures()) {
            return true;
        }
        if (publicKey == null || signatureHex == null || timestamp == null || body == null) {
            return false;
        }
        try {
            Signature signature = Signature.getInstance("Ed25519");
            signature.initVerify(publicKey);
            signature.update(timestamp.getBytes(StandardCharsets.UTF_8));
            signature.update(body);
            return signature.verify(HexFormat.of().parseHex(signatureHex));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.debug("[Discord] Signature check failed: {}", e.getMessage());
            return false;
        }
    }

    static PublicKey parsePublicKey(String hex) {
        if (hex == null || hex.isBlank()) {
            log.warn("[Discord] No public key configured (bot.discord.public-key), all interactions will be rejected");
            return null;
        }
        try {
            byte[] raw = HexFormat.of().parseHex(hex.trim());
            byte[] encoded = new byte[X509_ED25519_PREFIX.length + raw.length];
            System.arraycopy(X509_ED25519_PREFIX, 0, encoded, 0, X509_ED25519_PREFIX.length);
            System.arraycopy(raw, 0, encoded, X509_ED25519_PREFIX.length, raw.length);
            return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new IllegalStateException("Invalid Discord public key (bot.discord.public-key)", e);
        }
    }
}
