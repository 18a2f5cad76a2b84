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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Instantiates the type parameters embedded in encoded type names. A type
 * parameter <code>T</code> is written into a name as
 * <code>__TYPARAM__$T$__</code>. Bindings are learned by matching a generic
 * name against a more concrete one, and are then applied to other names by
 * textual replacement.
 */
public class TypeParamSubstitution {
	public static final Pattern MARKER = Pattern.compile("__TYPARAM__\\$([A-Za-z0-9_]+?)\\$__");

	private final Map<String, String> bindings;

	private TypeParamSubstitution(Map<String, String> bindings) {
		this.bindings = bindings;
	}

	public Map<String, String> getBindings() {
		return bindings;
	}

	/**
	 * Learn the bindings under which a generic name becomes a concrete one. If
	 * the two names cannot be matched, nothing is learned.
	 *
	 * @param generic
	 * @param concrete
	 * @return
	 */
	public static TypeParamSubstitution learn(String generic, String concrete) {
		Map<String, Integer> groups = new LinkedHashMap<>();
		StringBuilder regex = new StringBuilder();
		Matcher m = MARKER.matcher(generic);
		int last = 0;
		while (m.find()) {
			regex.append(Pattern.quote(generic.substring(last, m.start())));
			Integer group = groups.get(m.group(1));
			if (group == null) {
				groups.put(m.group(1), groups.size() + 1);
				regex.append("(.+?)");
			} else {
				regex.append("\\").append(group);
			}
			last = m.end();
		}
		regex.append(Pattern.quote(generic.substring(last)));
		//
		Map<String, String> bindings = new LinkedHashMap<>();
		Matcher c = Pattern.compile(regex.toString()).matcher(concrete);
		if (!groups.isEmpty() && c.matches()) {
			for (Map.Entry<String, Integer> e : groups.entrySet()) {
				bindings.put(e.getKey(), c.group(e.getValue()));
			}
		}
		return new TypeParamSubstitution(bindings);
	}

	/**
	 * Replace every bound type parameter within a given name.
	 *
	 * @param name
	 * @return
	 */
	public String apply(String name) {
		Matcher m = MARKER.matcher(name);
		StringBuffer sb = new StringBuffer();
		while (m.find()) {
			String binding = bindings.get(m.group(1));
			m.appendReplacement(sb, Matcher.quoteReplacement(binding != null ? binding : m.group()));
		}
		m.appendTail(sb);
		return sb.toString();
	}
}
