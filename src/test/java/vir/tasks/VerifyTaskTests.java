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
package vir.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static vir.core.ViperFile.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import vir.core.Field;
import vir.core.LocalVar;
import vir.core.PermAmount;
import vir.core.Position;
import vir.core.Type;
import vir.core.ViperFile;
import vir.core.ViperFile.Decl;
import vir.core.ViperFile.Expr;
import vir.util.Logger;

/**
 * Exercises verification against a stub backend, whose answers are fixed in
 * advance.
 */
public class VerifyTaskTests {
	private static final LocalVar X = new LocalVar("x", Type.Ref);
	private static final Field F = new Field("f", Type.Int);
	private static final Position PRE = new Position(9, 5, 2);

	/**
	 * Renders as:
	 *
	 * <pre>
	 * field f: Int
	 * method m(x: Ref)
	 *   requires acc(x.f, write)
	 * </pre>
	 */
	private static ViperFile unit() {
		ViperFile file = new ViperFile("test");
		file.getDeclarations().add(new Decl.Field("f", Type.Int, new Position(1, 1, 0)));
		Expr pre = ACC(FIELD(LOCAL(X), F), PermAmount.WRITE).setPosition(PRE);
		file.getDeclarations().add(new Decl.Method("m", Arrays.asList(X), Collections.emptyList(),
				Arrays.asList(pre), Collections.emptyList(), new Position(7, 1, 1)));
		return file;
	}

	private static Backend answering(List<Backend.Diagnostic> diagnostics) {
		return (id, program, timeout) -> diagnostics;
	}

	@Test
	public void success() {
		VerificationResult r = new VerifyTask(answering(Collections.emptyList())).apply(unit());
		assertTrue(r.isSuccess());
		assertSame(VerificationResult.SUCCESS, r);
	}

	@Test
	public void backendReceivesProgram() {
		List<String> programs = new ArrayList<>();
		List<Integer> timeouts = new ArrayList<>();
		Backend backend = (id, program, timeout) -> {
			programs.add(id + ":" + program);
			timeouts.add(timeout);
			return Collections.emptyList();
		};
		new VerifyTask(backend).setTimeout(3).apply(unit());
		assertEquals(1, programs.size());
		assertTrue(programs.get(0).startsWith("test:field f: Int"));
		assertTrue(programs.get(0).contains("requires acc(x.f, write)"));
		assertEquals(Arrays.asList(3000), timeouts);
	}

	@Test
	public void errorsMappedToItems() {
		List<Backend.Diagnostic> ds = Arrays.asList(new Backend.Diagnostic(3, 17, "insufficient permission"),
				new Backend.Diagnostic(3, 12, "precondition might not hold"),
				new Backend.Diagnostic(2, 3, "method failed"), new Backend.Diagnostic(3, 1, "unattributed"));
		VerificationResult r = new VerifyTask(answering(ds)).apply(unit());
		assertFalse(r.isSuccess());
		List<VerificationResult.Error> errors = ((VerificationResult.Failure) r).getErrors();
		assertEquals(4, errors.size());
		assertEquals(FIELD(LOCAL(X), F), errors.get(0).getEnclosingItem());
		assertEquals("insufficient permission", errors.get(0).getMessage());
		assertEquals(PRE, errors.get(1).getPosition());
		assertEquals(new Position(7, 1, 1), errors.get(2).getPosition());
		assertNull(errors.get(3).getEnclosingItem());
		assertEquals(Position.UNKNOWN, errors.get(3).getPosition());
	}

	@Test
	public void timeout() {
		VerificationResult r = new VerifyTask(answering(null)).setTimeout(5).apply(unit());
		assertFalse(r.isSuccess());
		List<VerificationResult.Error> errors = ((VerificationResult.Failure) r).getErrors();
		assertEquals(1, errors.size());
		assertEquals("timeout after 5s", errors.get(0).getMessage());
		assertNull(errors.get(0).getEnclosingItem());
	}

	@Test
	public void verboseOutput() {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
		List<Backend.Diagnostic> ds = Arrays.asList(new Backend.Diagnostic(3, 17, "insufficient permission"));
		new VerifyTask(answering(ds)).setVerbose(true).setOutput(out).apply(unit());
		String text = new String(buf.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(text.contains("Errors: test"));
		assertTrue(text.contains("3:17: insufficient permission"));
	}

	@Test
	public void quietByDefault() {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8);
		List<Backend.Diagnostic> ds = Arrays.asList(new Backend.Diagnostic(3, 17, "insufficient permission"));
		new VerifyTask(answering(ds)).setOutput(out).apply(unit());
		assertEquals(0, buf.size());
	}

	@Test
	public void logging() {
		List<String> messages = new ArrayList<>();
		Logger logger = (msg, time, memory) -> messages.add(msg);
		new VerifyTask(answering(Collections.emptyList()), logger).apply(unit());
		assertEquals(Arrays.asList("Verified test (Success)"), messages);
	}

	@Test
	public void defaultLogger() {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		Logger logger = new Logger.Default(new PrintStream(buf, true, StandardCharsets.UTF_8));
		new VerifyTask(answering(Collections.emptyList()), logger).apply(unit());
		String text = new String(buf.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(text.startsWith("Verified test (Success) ["));
	}

	@Test
	public void invalidConfiguration() {
		assertThrows(IllegalArgumentException.class, () -> new VerifyTask(null));
		assertThrows(IllegalArgumentException.class, () -> new VerifyTask(answering(null), null));
		assertThrows(IllegalArgumentException.class, () -> new VerifyTask(answering(null)).setTimeout(0));
	}

	@Test
	public void largestTimeout() {
		List<Integer> timeouts = new ArrayList<>();
		Backend backend = (id, program, timeout) -> {
			timeouts.add(timeout);
			return Collections.emptyList();
		};
		new VerifyTask(backend).setTimeout(VerifyTask.MAX_TIMEOUT).apply(unit());
		assertEquals(Arrays.asList(VerifyTask.MAX_TIMEOUT * 1000), timeouts);
		assertTrue(timeouts.get(0) > 0);
		assertThrows(IllegalArgumentException.class,
				() -> new VerifyTask(backend).setTimeout(VerifyTask.MAX_TIMEOUT + 1));
	}
}
