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

package org.apache.sshkeys.common.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * @author <a href="mailto:dev@mina.apache.org">Apache MINA SSHD Project</a>
 */
public final class GenericUtils {
    public static final byte[] EMPTY_BYTE_ARRAY = {};
    public static final String[] EMPTY_STRING_ARRAY = {};
    public static final Object[] EMPTY_OBJECT_ARRAY = {};

    /**
     * The delimiters recognized by {@link #stripQuotes(CharSequence)}
     */
    public static final char[] QUOTES = { '"', '\'' };

    private GenericUtils() {
        throw new UnsupportedOperationException("No instance");
    }

    public static String trimToEmpty(String s) {
        if (s == null) {
            return "";
        } else {
            return s.trim();
        }
    }

    public static int length(CharSequence cs) {
        return cs == null ? 0 : cs.length();
    }

    public static boolean isEmpty(CharSequence cs) {
        return length(cs) <= 0;
    }

    public static boolean isNotEmpty(CharSequence cs) {
        return !isEmpty(cs);
    }

    public static boolean isBlank(CharSequence cs) {
        int length = length(cs);
        for (int index = 0; index < length; index++) {
            if (!Character.isWhitespace(cs.charAt(index))) {
                return false;
            }
        }
        return true;
    }

    public static int size(Collection<?> c) {
        return c == null ? 0 : c.size();
    }

    public static boolean isEmpty(Collection<?> c) {
        return (c == null) || c.isEmpty();
    }

    public static boolean isNotEmpty(Collection<?> c) {
        return !isEmpty(c);
    }

    public static int size(Map<?, ?> m) {
        return m == null ? 0 : m.size();
    }

    public static boolean isEmpty(Map<?, ?> m) {
        return size(m) <= 0;
    }

    @SafeVarargs
    public static <T> int length(T... a) {
        return a == null ? 0 : a.length;
    }

    @SafeVarargs
    public static <T> boolean isEmpty(T... a) {
        return length(a) <= 0;
    }

    /**
     * Splits a string on the given separator. Empty segments between separators are kept, a trailing separator does
     * not produce an empty last segment
     *
     * @param  s  The string to split - may be {@code null}/empty
     * @param  ch The separator
     * @return    The split values - never {@code null}
     */
    public static String[] split(String s, char ch) {
        if (isEmpty(s)) {
            return EMPTY_STRING_ARRAY;
        }

        int lastPos = 0;
        int curPos = s.indexOf(ch);
        if (curPos < 0) {
            return new String[] { s };
        }

        Collection<String> values = new LinkedList<>();
        do {
            values.add(s.substring(lastPos, curPos));

            lastPos = curPos + 1;
            if (lastPos >= s.length()) {
                break;
            }

            curPos = s.indexOf(ch, lastPos);
        } while (curPos >= lastPos);

        if (lastPos < s.length()) {
            values.add(s.substring(lastPos));
        }

        return values.toArray(new String[values.size()]);
    }

    public static String join(Iterable<?> iter, char ch) {
        if (iter == null) {
            return "";
        }

        Iterator<?> it = iter.iterator();
        if (!it.hasNext()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        do {
            Object o = it.next();
            if (sb.length() > 0) {
                sb.append(ch);
            }
            sb.append(Objects.toString(o));
        } while (it.hasNext());

        return sb.toString();
    }

    /**
     * @param  s The {@link CharSequence} to check
     * @return   The same sequence without any enclosing matching pair of quotes - or the original if not quoted
     */
    public static CharSequence stripQuotes(CharSequence s) {
        int len = length(s);
        if (len < 2) {
            return s;
        }

        for (char delim : QUOTES) {
            if ((s.charAt(0) == delim) && (s.charAt(len - 1) == delim)) {
                return s.subSequence(1, len - 1);
            }
        }

        return s;
    }

    @SafeVarargs
    public static <T> List<T> unmodifiableList(T... values) {
        return isEmpty(values) ? Collections.emptyList() : Collections.unmodifiableList(Arrays.asList(values));
    }

    public static <T> List<T> unmodifiableList(Collection<? extends T> values) {
        return isEmpty(values) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    @SafeVarargs
    public static <V> SortedSet<V> asSortedSet(Comparator<? super V> comp, V... values) {
        SortedSet<V> set = new TreeSet<>(Objects.requireNonNull(comp, "No comparator"));
        if (length(values) > 0) {
            set.addAll(Arrays.asList(values));
        }
        return set;
    }
}
