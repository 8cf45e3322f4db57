/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


package org.apache.sshkeys.config.keys.x509;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

import org.apache.sshkeys.common.digest.BuiltinDigests;
import org.apache.sshkeys.common.util.GenericUtils;
import org.apache.sshkeys.common.util.ValidateUtils;
import org.bouncycastle.asn1.ASN1BMPString;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1IA5String;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1PrintableString;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.ASN1T61String;
import org.bouncycastle.asn1.ASN1UTF8String;
import org.bouncycastle.asn1.ASN1VisibleString;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.asn1.DERSet;
import org.bouncycastle.asn1.DERUTF8String;
import org.bouncycastle.asn1.x500.AttributeTypeAndValue;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;

/**
 * Distinguished name helpers
 *
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class X509NameUtils {
    private X509NameUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    /**
     * @param  name                     Either an RFC 4514 ({@code CN=x,O=y}) or an OpenSSL style ({@code /O=y/CN=x})
     *                                  name
     * @return                          The parsed name
     * @throws IllegalArgumentException If the name cannot be parsed
     */
    public static X500Name parseName(String name) {
        String value = ValidateUtils.checkNotNullAndNotEmpty(GenericUtils.trimToEmpty(name), "No name");
        try {
            if (value.charAt(0) != '/') {
                return new X500Name(BCStyle.INSTANCE, value);
            }

            X500NameBuilder builder = new X500NameBuilder(BCStyle.INSTANCE);
            for (String rdn : GenericUtils.split(value.substring(1), '/')) {
                int pos = rdn.indexOf('=');
                ValidateUtils.checkTrue(pos > 0, "Invalid name component: %s", rdn);
                ASN1ObjectIdentifier oid = BCStyle.INSTANCE.attrNameToOID(rdn.substring(0, pos).trim());
                builder.addRDN(oid, rdn.substring(pos + 1).trim());
            }
            return builder.build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IllegalArgumentException("Invalid X.509 name: " + name, e);
        }
    }

    /**
     * Computes the name hash used by OpenSSL to index certificate directories ({@code X509_NAME_hash}) - the first
     * 4 bytes, little endian, of the SHA-1 of the canonical name encoding.
     *
     * @param  name The name
     * @return      8 lowercase hex digits
     */
    public static String getNameHash(X500Name name) {
        byte[] canonical = getCanonicalEncoding(name);
        byte[] digest;
        try {
            digest = MessageDigest.getInstance(BuiltinDigests.sha1.getAlgorithm()).digest(canonical);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }

        long hash = (digest[0] & 0xFFL)
                | ((digest[1] & 0xFFL) << 8)
                | ((digest[2] & 0xFFL) << 16)
                | ((digest[3] & 0xFFL) << 24);
        return String.format(Locale.ENGLISH, "%08x", hash);
    }

    /**
     * String values are converted to lowercased {@code UTF8String}s with leading/trailing whitespace removed and
     * inner whitespace runs collapsed to a single space. The RDN sets are concatenated without the outer sequence.
     *
     * @param  name The name
     * @return      The canonical encoding
     */
    public static byte[] getCanonicalEncoding(X500Name name) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            for (RDN rdn : name.getRDNs()) {
                AttributeTypeAndValue[] entries = rdn.getTypesAndValues();
                ASN1EncodableVector set = new ASN1EncodableVector(entries.length);
                for (AttributeTypeAndValue entry : entries) {
                    set.add(new DERSequence(new ASN1Encodable[] { entry.getType(), canonicalValue(entry.getValue()) }));
                }
                out.write(new DERSet(set).getEncoded(ASN1Encoding.DER));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode name " + name, e);
        }
        return out.toByteArray();
    }

    private static ASN1Encodable canonicalValue(ASN1Encodable value) {
        if (!(value instanceof ASN1UTF8String || value instanceof ASN1BMPString || value instanceof ASN1PrintableString
                || value instanceof ASN1T61String || value instanceof ASN1IA5String
                || value instanceof ASN1VisibleString)) {
            return value;
        }

        String text = ((ASN1String) value).getString();
        StringBuilder sb = new StringBuilder(text.length());
        boolean pendingSpace = false;
        for (int index = 0; index < text.length(); index++) {
            char ch = text.charAt(index);
            if (isAsciiSpace(ch)) {
                pendingSpace = sb.length() > 0;
                continue;
            }

            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            sb.append(((ch >= 'A') && (ch <= 'Z')) ? (char) (ch + ('a' - 'A')) : ch);
        }
        return new DERUTF8String(sb.toString());
    }

    private static boolean isAsciiSpace(char ch) {
        return (ch == ' ') || (ch == '\t') || (ch == '\n') || (ch == '\u000B') || (ch == '\f') || (ch == '\r');
    }
}
