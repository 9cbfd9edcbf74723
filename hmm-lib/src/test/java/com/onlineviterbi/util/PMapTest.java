/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package com.onlineviterbi.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PMapTest {

    @Test
    public void singleStringPropertyCanBeRetrieved() {
        PMap subject = new PMap("foo=bar");

        assertEquals("bar", subject.getString("foo", ""));
    }

    @Test
    public void propertyFromStringWithMultiplePropertiesCanBeRetrieved() {
        PMap subject = new PMap("foo=valueA|bar=valueB");

        assertEquals("valueA", subject.getString("foo", ""));
        assertEquals("valueB", subject.getString("bar", ""));
    }

    @Test
    public void keyCannotHaveAnyCasing() {
        PMap subject = new PMap("foo=valueA|bar=valueB");

        assertEquals("valueA", subject.getString("foo", ""));
        assertEquals("", subject.getString("Foo", ""));
    }

    @Test
    public void numericPropertyCanBeRetrievedAsDouble() {
        PMap subject = new PMap("foo=123.45|bar=1e-11");

        assertEquals(123.45, subject.getDouble("foo", 0), 1e-10);
        // no detour via float
        assertEquals(1e-11, subject.getDouble("bar", 0), 0);
        assertEquals("1.0E-11", subject.getString("bar", ""));
    }

    @Test
    public void hasReturnsCorrectResult() {
        PMap subject = new PMap("foo=123.45|bar=56.78");

        assertTrue(subject.has("foo"));
        assertTrue(subject.has("bar"));
        assertFalse(subject.has("baz"));
    }

    @Test
    public void readArgs() {
        PMap subject = PMap.read(new String[]{"--model=a.yml", "-constraintLength=3", "keep_message_history=true", "ignored"});

        assertEquals("a.yml", subject.getString("model", ""));
        assertEquals(3, subject.getInt("constraint_length", 0));
        assertTrue(subject.getBool("keep_message_history", false));
        assertEquals(3, subject.toMap().size());
        assertThrows(IllegalArgumentException.class, () -> PMap.read(new String[]{"a=1", "a=2"}));
    }

    @Test
    public void putAllOverrides() {
        PMap subject = new PMap("a=1|b=2").putAll(new PMap("b=3"));

        assertEquals(1, subject.getInt("a", 0));
        assertEquals(3, subject.getInt("b", 0));
        subject.remove("a");
        assertFalse(subject.has("a"));
        assertTrue(new PMap().isEmpty());
    }
}
