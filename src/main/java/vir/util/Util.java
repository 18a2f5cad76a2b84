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
package vir.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public class Util {

    /**
     * Map a given list of elements from one kind to another.
     *
     * @param items
     * @param fn
     * @param <S>
     * @param <T>
     * @return
     */
    public static <S,T> List<T> map(List<S> items, Function<S,T> fn) {
        ArrayList<T> rs = new ArrayList<>();
        for(int i=0;i!=items.size();++i) {
            rs.add(fn.apply(items.get(i)));
        }
        return rs;
    }

    /**
     * Functional list append.  This creates a fresh list containing both <code>left</code> and <code>right</code> operands.
     * @param left
     * @param right
     * @param <T>
     * @return
     */
    public static <T> List<T> append(List<T> left, List<T> right) {
        ArrayList<T> result = new ArrayList<>();
        result.addAll(left);
        result.addAll(right);
        return result;
    }

    /**
     * Join a list of items into a string, using a given separator.
     *
     * @param items
     * @param separator
     * @return
     */
    public static String join(List<?> items, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i != items.size(); ++i) {
            if (i != 0) {
                sb.append(separator);
            }
            sb.append(items.get(i));
        }
        return sb.toString();
    }
}
