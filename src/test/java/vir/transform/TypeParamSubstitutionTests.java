// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package vir.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class TypeParamSubstitutionTests {

	@Test
	public void learnSingleParameter() {
		TypeParamSubstitution s = TypeParamSubstitution.learn("Box$__TYPARAM__$T$__", "Box$i32");
		assertEquals("i32", s.getBindings().get("T"));
		assertEquals("ref$i32", s.apply("ref$__TYPARAM__$T$__"));
	}

	@Test
	public void learnSeveralParameters() {
		TypeParamSubstitution s = TypeParamSubstitution.learn("Pair$__TYPARAM__$A$__$__TYPARAM__$B$__",
				"Pair$u8$bool");
		assertEquals("u8", s.getBindings().get("A"));
		assertEquals("bool", s.getBindings().get("B"));
		assertEquals("Map$bool$u8", s.apply("Map$__TYPARAM__$B$__$__TYPARAM__$A$__"));
	}

	@Test
	public void repeatedParameterMustAgree() {
		TypeParamSubstitution s = TypeParamSubstitution.learn("Twin$__TYPARAM__$T$__$__TYPARAM__$T$__",
				"Twin$u8$u8");
		assertEquals("u8", s.getBindings().get("T"));
		s = TypeParamSubstitution.learn("Twin$__TYPARAM__$T$__$__TYPARAM__$T$__", "Twin$u8$u16");
		assertTrue(s.getBindings().isEmpty());
	}

	@Test
	public void mismatchLearnsNothing() {
		TypeParamSubstitution s = TypeParamSubstitution.learn("Box$__TYPARAM__$T$__", "Cell$i32");
		assertTrue(s.getBindings().isEmpty());
		assertEquals("ref$__TYPARAM__$T$__", s.apply("ref$__TYPARAM__$T$__"));
	}

	@Test
	public void unboundParametersAreKept() {
		TypeParamSubstitution s = TypeParamSubstitution.learn("Box$__TYPARAM__$T$__", "Box$i32");
		assertEquals("Pair$i32$__TYPARAM__$U$__", s.apply("Pair$__TYPARAM__$T$__$__TYPARAM__$U$__"));
	}
}
