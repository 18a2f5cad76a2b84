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

import static com.google.common.base.Preconditions.checkArgument;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import vir.core.ViperFile;
import vir.io.ViperFilePrinter;
import vir.util.Logger;
import vir.util.MappablePrintWriter;

/**
 * Verifies a unit by rendering it and handing the text to a backend. Errors
 * reported by the backend are traced back to the items responsible for them.
 */
public class VerifyTask {
	/**
	 * Handle for the backend verifier.
	 */
	private final Backend backend;
	/**
	 * Logger for useful stuff
	 */
	private final Logger logger;
	/**
	 * Stream to which verbose output is written.
	 */
	private PrintStream out = System.out;
	/**
	 * Specify whether to print verbose progress messages or not
	 */
	private boolean verbose = false;
	/**
	 * Backend timeout (in seconds)
	 */
	private int timeout = 10;
	/**
	 * Largest timeout (in seconds) whose value in milliseconds is representable
	 */
	public static final int MAX_TIMEOUT = Integer.MAX_VALUE / 1000;

	public VerifyTask(Backend backend) {
		this(backend, Logger.NULL);
	}

	public VerifyTask(Backend backend, Logger logger) {
		checkArgument(backend != null, "invalid backend");
		checkArgument(logger != null, "invalid logger");
		this.backend = backend;
		this.logger = logger;
	}

	public VerifyTask setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	/**
	 * Set the backend timeout, in seconds. This is handed to the backend in
	 * milliseconds, so must fit an <code>int</code> once scaled.
	 *
	 * @param timeout
	 * @return
	 */
	public VerifyTask setTimeout(int timeout) {
		checkArgument(timeout > 0 && timeout <= MAX_TIMEOUT, "invalid timeout %s", timeout);
		this.timeout = timeout;
		return this;
	}

	public VerifyTask setOutput(PrintStream out) {
		this.out = out;
		return this;
	}

	public VerificationResult apply(ViperFile file) {
		Runtime runtime = Runtime.getRuntime();
		long start = System.currentTimeMillis();
		long memory = runtime.freeMemory();
		// Render the unit, recording where each item ended up
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		ViperFilePrinter printer = new ViperFilePrinter(buf);
		printer.write(file);
		String program = new String(buf.toByteArray(), StandardCharsets.UTF_8);
		MappablePrintWriter.Mapping<ViperFile.Item> mapping = printer.getMapping();
		//
		List<Backend.Diagnostic> diagnostics = backend.verify(file.getName(), program, timeout * 1000);
		VerificationResult result;
		if (diagnostics == null) {
			VerificationResult.Error error = new VerificationResult.Error(0, 0,
					"timeout after " + timeout + "s", null);
			result = new VerificationResult.Failure(Collections.singletonList(error));
		} else if (diagnostics.isEmpty()) {
			result = VerificationResult.SUCCESS;
		} else {
			List<VerificationResult.Error> errors = new ArrayList<>();
			for (Backend.Diagnostic d : diagnostics) {
				ViperFile.Item item = mapping.get(d.getLine(), d.getColumn());
				errors.add(new VerificationResult.Error(d.getLine(), d.getColumn(), d.getMessage(), item));
			}
			result = new VerificationResult.Failure(errors);
		}
		//
		if (verbose && result instanceof VerificationResult.Failure) {
			out.println("=================================================");
			out.println("Errors: " + file.getName());
			out.println("=================================================");
			for (VerificationResult.Error e : ((VerificationResult.Failure) result).getErrors()) {
				out.println(e);
			}
		}
		long endTime = System.currentTimeMillis();
		logger.logTimedMessage("Verified " + file.getName() + " (" + result + ")", endTime - start,
				memory - runtime.freeMemory());
		return result;
	}
}
