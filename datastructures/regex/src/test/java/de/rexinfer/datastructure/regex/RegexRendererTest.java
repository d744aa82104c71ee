/* Copyright (C) 2026 The rexinfer Authors
 * This file is part of rexinfer.
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
package de.rexinfer.datastructure.regex;

import java.util.regex.Pattern;

import org.testng.Assert;
import org.testng.annotations.Test;

public class RegexRendererTest {

    private static final Regex<Character> A = Regex.symbol('a');
    private static final Regex<Character> B = Regex.symbol('b');
    private static final Regex<Character> C = Regex.symbol('c');

    @Test
    public void testAtoms() {
        Assert.assertEquals(A.toString(), "a");
        Assert.assertEquals(Regex.<Character>epsilon().toString(), "ε");
        Assert.assertEquals(Regex.<Character>emptySet().toString(), "∅");
    }

    @Test
    public void testPrecedence() {
        Assert.assertEquals(Regex.concat(Regex.star(A), B).toString(), "a*b");
        Assert.assertEquals(Regex.star(Regex.concat(A, B)).toString(), "(ab)*");
        Assert.assertEquals(Regex.union(A, Regex.concat(B, C)).toString(), "a|bc");
        Assert.assertEquals(Regex.concat(Regex.union(A, B), C).toString(), "(a|b)c");
        Assert.assertEquals(Regex.concat(C, Regex.union(A, B)).toString(), "c(a|b)");
        Assert.assertEquals(Regex.star(Regex.union(A, B)).toString(), "(a|b)*");
        Assert.assertEquals(Regex.union(Regex.union(A, B), C).toString(), "a|b|c");
        Assert.assertEquals(Regex.concat(Regex.concat(A, B), C).toString(), "abc");
        Assert.assertEquals(Regex.star(Regex.star(A)).toString(), "(a*)*");
    }

    @Test
    public void testMultiCharacterSymbols() {
        final Regex<String> word = Regex.symbol("ab");
        Assert.assertEquals(Regex.star(word).toString(), "(ab)*");
        Assert.assertEquals(Regex.concat(word, Regex.symbol("c")).toString(), "abc");
    }

    @Test
    public void testSupplementaryCharacterIsAtomic() {
        final Regex<String> grin = Regex.symbol("\uD83D\uDE00");
        Assert.assertEquals(Regex.star(grin).toString(), "\uD83D\uDE00*");

        final Pattern pattern = Pattern.compile(RegexRenderer.<String>javaPattern().render(Regex.star(grin)));
        Assert.assertTrue(pattern.matcher("\uD83D\uDE00\uD83D\uDE00").matches());
        Assert.assertFalse(pattern.matcher("\uD83D\uDE00\uDE00").matches());
    }

    @Test
    public void testJavaPattern() {
        final RegexRenderer<Character> renderer = RegexRenderer.javaPattern();
        final Regex<Character> plus = Regex.symbol('+');
        final Regex<Character> regex = Regex.concat(Regex.star(plus), Regex.union(Regex.epsilon(), Regex.symbol('.')));

        final String rendered = renderer.render(regex);
        Assert.assertEquals(rendered, "\\+*(()|\\.)");

        final Pattern pattern = Pattern.compile(rendered);
        Assert.assertTrue(pattern.matcher("").matches());
        Assert.assertTrue(pattern.matcher("++.").matches());
        Assert.assertFalse(pattern.matcher("+a").matches());
    }

    @Test
    public void testJavaPatternEmptySet() {
        final Pattern pattern = Pattern.compile(RegexRenderer.<Character>javaPattern().render(Regex.emptySet()));
        Assert.assertFalse(pattern.matcher("").matches());
        Assert.assertFalse(pattern.matcher("a").matches());
    }

    @Test
    public void testCustomRenderer() {
        final RegexRenderer<Integer> renderer = new RegexRenderer<>(i -> "<" + i + ">", "EPS", "NONE");
        final Regex<Integer> regex = Regex.union(Regex.concat(Regex.symbol(1), Regex.symbol(2)), Regex.epsilon());
        Assert.assertEquals(renderer.render(regex), "<1><2>|EPS");
        Assert.assertEquals(renderer.render(Regex.star(Regex.symbol(3))), "(<3>)*");
    }
}
