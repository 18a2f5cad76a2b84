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
package vir.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class TypeTests {

	@Test
	public void references() {
		assertTrue(Type.Ref.isRef());
		assertTrue(new Type.TypedRef("P").isRef());
		assertFalse(Type.Int.isRef());
		assertEquals(new Type.TypedRef("P"), new Type.TypedRef("P"));
		assertEquals("Ref(P)", new Type.TypedRef("P").toString());
		assertEquals("Int", Type.Int.toString());
	}

	@Test
	public void variants() {
		assertEquals(new Type.TypedRef("OptionSome"), new Type.TypedRef("Option").variant("Some"));
		assertThrows(IllegalStateException.class, () -> Type.Bool.variant("Some"));
	}

	@Test
	public void patching() {
		Map<String, String> substs = new LinkedHashMap<>();
		substs.put("__T", "i32");
		substs.put("__U", "bool");
		assertEquals(new Type.TypedRef("Pair$i32$bool"), new Type.TypedRef("Pair$__T$__U").patch(substs));
		assertSame(Type.Int, Type.Int.patch(substs));
		Type unchanged = new Type.TypedRef("Other");
		assertSame(unchanged, unchanged.patch(Collections.emptyMap()));
	}

	@Test
	public void compatibility() {
		assertTrue(new Type.TypedRef("Box$__TYPARAM__$T$__").isCompatible(new Type.TypedRef("Box$i32")));
		assertTrue(Type.Int.isCompatible(Type.Int));
		assertFalse(Type.Int.isCompatible(Type.Bool));
		assertFalse(Type.Ref.isCompatible(new Type.TypedRef("Box")));
		assertFalse(new Type.TypedRef("Box").isCompatible(Type.Ref));
	}
}
