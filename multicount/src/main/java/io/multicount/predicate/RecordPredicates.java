/*
 * Copyright (C) 2015-2018 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.multicount.predicate;

import com.google.common.base.Joiner;
import io.multicount.record.Record;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.*;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.Lists.newArrayList;
import static com.google.common.collect.Sets.newLinkedHashSet;
import static java.util.Collections.emptySet;
import static java.util.Collections.singleton;

public class RecordPredicates {
	private RecordPredicates() {
	}

	private static class PredicateSimplifierKey<L extends RecordPredicate, R extends RecordPredicate> {
		private final Class<L> leftType;
		private final Class<R> rightType;

		private PredicateSimplifierKey(Class<L> leftType, Class<R> rightType) {
			this.leftType = leftType;
			this.rightType = rightType;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateSimplifierKey<?, ?> that = (PredicateSimplifierKey<?, ?>) o;

			if (!leftType.equals(that.leftType)) return false;
			return rightType.equals(that.rightType);
		}

		@Override
		public int hashCode() {
			int result = leftType.hashCode();
			result = 31 * result + rightType.hashCode();
			return result;
		}
	}

	private interface PredicateSimplifier<L extends RecordPredicate, R extends RecordPredicate> {
		@Nullable
		RecordPredicate simplifyAnd(L left, R right);
	}

	private static final Map<PredicateSimplifierKey<?, ?>, PredicateSimplifier<?, ?>> simplifiers = new HashMap<>();

	private static final List<Class<? extends RecordPredicate>> PREDICATE_TYPES = Arrays.asList(
			PredicateAlwaysFalse.class, PredicateAlwaysTrue.class, PredicateNot.class,
			PredicateEq.class, PredicateNotEq.class, PredicateIn.class, PredicateIsNull.class,
			PredicateBetween.class, PredicateRegexp.class, PredicateAnd.class, PredicateOr.class);

	private static <L extends RecordPredicate, R extends RecordPredicate> void register(Class<L> leftType, Class<R> rightType,
			PredicateSimplifier<L, R> operation) {
		PredicateSimplifierKey<L, R> keyLeftRight = new PredicateSimplifierKey<>(leftType, rightType);
		checkState(!simplifiers.containsKey(keyLeftRight));
		simplifiers.put(keyLeftRight, operation);
		if (!rightType.equals(leftType)) {
			PredicateSimplifierKey<R, L> keyRightLeft = new PredicateSimplifierKey<>(rightType, leftType);
			checkState(!simplifiers.containsKey(keyRightLeft));
			simplifiers.put(keyRightLeft, (PredicateSimplifier<R, L>) (right, left) -> operation.simplifyAnd(left, right));
		}
	}

	@SuppressWarnings("unchecked")
	private static <L extends RecordPredicate> void registerWithAll(Class<L> leftType, Class<? extends RecordPredicate> fromType,
			PredicateSimplifier<L, RecordPredicate> operation) {
		boolean started = false;
		for (Class<? extends RecordPredicate> rightType : PREDICATE_TYPES) {
			started |= rightType.equals(fromType);
			if (started) {
				register(leftType, (Class<RecordPredicate>) (Class<?>) rightType, operation);
			}
		}
	}

	static {
		registerWithAll(PredicateAlwaysFalse.class, PredicateAlwaysFalse.class, (left, right) -> alwaysFalse());
		registerWithAll(PredicateAlwaysTrue.class, PredicateAlwaysTrue.class, (left, right) -> right);
		registerWithAll(PredicateNot.class, PredicateNot.class, (left, right) -> left.predicate.equals(right) ? alwaysFalse() : null);

		register(PredicateEq.class, PredicateEq.class, (left, right) -> {
			if (!left.key.equals(right.key))
				return null;
			return valuesEqual(left.value, right.value) ? left : alwaysFalse();
		});
		register(PredicateEq.class, PredicateNotEq.class, (left, right) -> {
			if (!left.key.equals(right.key))
				return null;
			return valuesEqual(left.value, right.value) ? alwaysFalse() : left;
		});
		register(PredicateEq.class, PredicateIn.class, (left, right) -> {
			if (!left.key.equals(right.key))
				return null;
			return right.contains(left.value) ? left : alwaysFalse();
		});
		register(PredicateEq.class, PredicateIsNull.class, (left, right) -> {
			if (!left.key.equals(right.key))
				return null;
			return alwaysFalse();
		});
		register(PredicateEq.class, PredicateBetween.class, (left, right) -> {
			if (!left.key.equals(right.key))
				return null;
			if (compare(right.from, left.value) <= 0 && compare(right.to, left.value) >= 0)
				return left;
			return alwaysFalse();
		});
		register(PredicateBetween.class, PredicateBetween.class, (left, right) -> {
			if (!left.key.equals(right.key))
				return null;
			Comparable<?> from = compare(left.from, right.from) >= 0 ? left.from : right.from;
			Comparable<?> to = compare(left.to, right.to) <= 0 ? left.to : right.to;
			return between(left.key, from, to).simplify();
		});
	}

	@SuppressWarnings("unchecked")
	@Nullable
	private static RecordPredicate simplifyAnd(RecordPredicate left, RecordPredicate right) {
		if (left.equals(right))
			return left;
		PredicateSimplifierKey<?, ?> key = new PredicateSimplifierKey<>(left.getClass(), right.getClass());
		PredicateSimplifier<RecordPredicate, RecordPredicate> simplifier = (PredicateSimplifier<RecordPredicate, RecordPredicate>) simplifiers.get(key);
		if (simplifier == null)
			return null;
		return simplifier.simplifyAnd(left, right);
	}

	static boolean valuesEqual(@Nullable Object left, @Nullable Object right) {
		if (left instanceof Number && right instanceof Number && left.getClass() != right.getClass()) {
			return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right)) == 0;
		}
		return Objects.equals(left, right);
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	static int compare(Object left, Object right) {
		if (left instanceof Number && right instanceof Number && left.getClass() != right.getClass()) {
			return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right));
		}
		return ((Comparable) left).compareTo(right);
	}

	private static BigDecimal toBigDecimal(Number number) {
		return number instanceof BigDecimal ? (BigDecimal) number : new BigDecimal(number.toString());
	}

	static String render(@Nullable Object value) {
		if (value instanceof CharSequence || value instanceof Character) {
			return "'" + value.toString().replace("'", "''") + "'";
		}
		return String.valueOf(value);
	}

	public static final class PredicateAlwaysFalse implements RecordPredicate {
		private static final PredicateAlwaysFalse instance = new PredicateAlwaysFalse();

		private PredicateAlwaysFalse() {
		}

		@Override
		public RecordPredicate simplify() {
			return this;
		}

		@Override
		public Set<String> getFields() {
			return emptySet();
		}

		@Override
		public Boolean test(Record record) {
			return Boolean.FALSE;
		}

		@Override
		public String toString() {
			return "FALSE";
		}
	}

	public static final class PredicateAlwaysTrue implements RecordPredicate {
		private static final PredicateAlwaysTrue instance = new PredicateAlwaysTrue();

		private PredicateAlwaysTrue() {
		}

		@Override
		public RecordPredicate simplify() {
			return this;
		}

		@Override
		public Set<String> getFields() {
			return emptySet();
		}

		@Override
		public Boolean test(Record record) {
			return Boolean.TRUE;
		}

		@Override
		public String toString() {
			return "TRUE";
		}
	}

	public static final class PredicateNot implements RecordPredicate {
		private final RecordPredicate predicate;

		private PredicateNot(RecordPredicate predicate) {
			this.predicate = predicate;
		}

		public RecordPredicate getPredicate() {
			return predicate;
		}

		@Override
		public RecordPredicate simplify() {
			if (predicate instanceof PredicateNot)
				return ((PredicateNot) predicate).predicate.simplify();
			RecordPredicate simplified = predicate.simplify();
			if (simplified == alwaysTrue())
				return alwaysFalse();
			if (simplified == alwaysFalse())
				return alwaysTrue();
			return not(simplified);
		}

		@Override
		public Set<String> getFields() {
			return predicate.getFields();
		}

		@Nullable
		@Override
		public Boolean test(Record record) {
			Boolean result = predicate.test(record);
			return result == null ? null : !result;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateNot that = (PredicateNot) o;

			return predicate.equals(that.predicate);
		}

		@Override
		public int hashCode() {
			return predicate.hashCode();
		}

		@Override
		public String toString() {
			return "NOT " + predicate;
		}
	}

	public static final class PredicateEq implements RecordPredicate {
		final String key;
		final Object value;

		private PredicateEq(String key, Object value) {
			this.key = key;
			this.value = value;
		}

		public String getKey() {
			return key;
		}

		public Object getValue() {
			return value;
		}

		@Override
		public RecordPredicate simplify() {
			return this;
		}

		@Override
		public Set<String> getFields() {
			return singleton(key);
		}

		@Nullable
		@Override
		public Boolean test(Record record) {
			Object fieldValue = record.get(key);
			return fieldValue == null ? null : valuesEqual(fieldValue, value);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateEq that = (PredicateEq) o;

			if (!key.equals(that.key)) return false;
			return value.equals(that.value);
		}

		@Override
		public int hashCode() {
			int result = key.hashCode();
			result = 31 * result + value.hashCode();
			return result;
		}

		@Override
		public String toString() {
			return key + '=' + render(value);
		}
	}

	public static final class PredicateNotEq implements RecordPredicate {
		final String key;
		final Object value;

		private PredicateNotEq(String key, Object value) {
			this.key = key;
			this.value = value;
		}

		public String getKey() {
			return key;
		}

		public Object getValue() {
			return value;
		}

		@Override
		public RecordPredicate simplify() {
			return this;
		}

		@Override
		public Set<String> getFields() {
			return singleton(key);
		}

		@Nullable
		@Override
		public Boolean test(Record record) {
			Object fieldValue = record.get(key);
			return fieldValue == null ? null : !valuesEqual(fieldValue, value);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateNotEq that = (PredicateNotEq) o;

			if (!key.equals(that.key)) return false;
			return value.equals(that.value);
		}

		@Override
		public int hashCode() {
			int result = key.hashCode();
			result = 31 * result + value.hashCode();
			return result;
		}

		@Override
		public String toString() {
			return key + "<>" + render(value);
		}
	}

	public static final class PredicateIn implements RecordPredicate {
		static final Joiner JOINER = Joiner.on(", ");
		final String key;
		final Set<Object> values;

		private PredicateIn(String key, Set<Object> values) {
			this.key = key;
			this.values = values;
		}

		public String getKey() {
			return key;
		}

		public Set<Object> getValues() {
			return values;
		}

		boolean contains(Object value) {
			for (Object candidate : values) {
				if (valuesEqual(candidate, value))
					return true;
			}
			return false;
		}

		@Override
		public RecordPredicate simplify() {
			if (values.isEmpty())
				return alwaysFalse();
			if (values.size() == 1)
				return eq(key, values.iterator().next());
			return this;
		}

		@Override
		public Set<String> getFields() {
			return singleton(key);
		}

		@Nullable
		@Override
		public Boolean test(Record record) {
			Object fieldValue = record.get(key);
			return fieldValue == null ? null : contains(fieldValue);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateIn that = (PredicateIn) o;

			if (!key.equals(that.key)) return false;
			return values.equals(that.values);
		}

		@Override
		public int hashCode() {
			int result = key.hashCode();
			result = 31 * result + values.hashCode();
			return result;
		}

		@Override
		public String toString() {
			List<String> rendered = new ArrayList<>();
			for (Object value : values) {
				rendered.add(render(value));
			}
			return key + " IN (" + JOINER.join(rendered) + ")";
		}
	}

	public static final class PredicateIsNull implements RecordPredicate {
		final String key;

		private PredicateIsNull(String key) {
			this.key = key;
		}

		public String getKey() {
			return key;
		}

		@Override
		public RecordPredicate simplify() {
			return this;
		}

		@Override
		public Set<String> getFields() {
			return singleton(key);
		}

		@Override
		public Boolean test(Record record) {
			return record.get(key) == null;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateIsNull that = (PredicateIsNull) o;

			return key.equals(that.key);
		}

		@Override
		public int hashCode() {
			return key.hashCode();
		}

		@Override
		public String toString() {
			return key + " IS NULL";
		}
	}

	public static final class PredicateRegexp implements RecordPredicate {
		final String key;
		final String regexp;
		private final Pattern pattern;

		private PredicateRegexp(String key, String regexp) {
			this.key = key;
			this.regexp = regexp;
			this.pattern = Pattern.compile(regexp);
		}

		public String getKey() {
			return key;
		}

		public String getRegexp() {
			return regexp;
		}

		@Override
		public RecordPredicate simplify() {
			return this;
		}

		@Override
		public Set<String> getFields() {
			return singleton(key);
		}

		@Nullable
		@Override
		public Boolean test(Record record) {
			Object fieldValue = record.get(key);
			return fieldValue == null ? null : pattern.matcher(fieldValue.toString()).matches();
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateRegexp that = (PredicateRegexp) o;

			if (!key.equals(that.key)) return false;
			return regexp.equals(that.regexp);
		}

		@Override
		public int hashCode() {
			int result = key.hashCode();
			result = 31 * result + regexp.hashCode();
			return result;
		}

		@Override
		public String toString() {
			return key + " ~ " + render(regexp);
		}
	}

	public static final class PredicateBetween implements RecordPredicate {
		final String key;
		final Comparable<?> from;
		final Comparable<?> to;

		PredicateBetween(String key, Comparable<?> from, Comparable<?> to) {
			this.key = key;
			this.from = from;
			this.to = to;
		}

		public String getKey() {
			return key;
		}

		public Comparable<?> getFrom() {
			return from;
		}

		public Comparable<?> getTo() {
			return to;
		}

		@Override
		public RecordPredicate simplify() {
			return (compare(from, to) > 0) ? alwaysFalse() : (valuesEqual(from, to) ? eq(key, from) : this);
		}

		@Override
		public Set<String> getFields() {
			return singleton(key);
		}

		@Nullable
		@Override
		public Boolean test(Record record) {
			Object fieldValue = record.get(key);
			if (fieldValue == null)
				return null;
			return compare(from, fieldValue) <= 0 && compare(to, fieldValue) >= 0;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateBetween that = (PredicateBetween) o;

			if (!key.equals(that.key)) return false;
			if (!from.equals(that.from)) return false;
			return to.equals(that.to);
		}

		@Override
		public int hashCode() {
			int result = key.hashCode();
			result = 31 * result + from.hashCode();
			result = 31 * result + to.hashCode();
			return result;
		}

		@Override
		public String toString() {
			return key + " BETWEEN " + render(from) + " AND " + render(to);
		}
	}

	public static final class PredicateAnd implements RecordPredicate {
		static final Joiner JOINER = Joiner.on(" AND ");
		final List<RecordPredicate> predicates;

		private PredicateAnd(List<RecordPredicate> predicates) {
			this.predicates = predicates;
		}

		public List<RecordPredicate> getPredicates() {
			return predicates;
		}

		@Override
		public RecordPredicate simplify() {
			Set<RecordPredicate> simplifiedPredicates = newLinkedHashSet();
			for (RecordPredicate predicate : predicates) {
				RecordPredicate simplified = predicate.simplify();
				if (simplified instanceof PredicateAnd) {
					simplifiedPredicates.addAll(((PredicateAnd) simplified).predicates);
				} else {
					simplifiedPredicates.add(simplified);
				}
			}
			boolean simplified;
			do {
				simplified = false;
				Set<RecordPredicate> newPredicates = newLinkedHashSet();
				L:
				for (RecordPredicate newPredicate : simplifiedPredicates) {
					for (RecordPredicate simplifiedPredicate : newPredicates) {
						RecordPredicate maybeSimplified = simplifyAnd(newPredicate, simplifiedPredicate);
						if (maybeSimplified != null) {
							newPredicates.remove(simplifiedPredicate);
							newPredicates.add(maybeSimplified);
							simplified = true;
							continue L;
						}
					}
					newPredicates.add(newPredicate);
				}
				simplifiedPredicates = newPredicates;
			} while (simplified);

			return simplifiedPredicates.isEmpty() ?
					alwaysTrue() :
					simplifiedPredicates.size() == 1 ?
							simplifiedPredicates.iterator().next() :
							and(newArrayList(simplifiedPredicates));
		}

		@Override
		public Set<String> getFields() {
			Set<String> result = new LinkedHashSet<>();
			for (RecordPredicate predicate : predicates) {
				result.addAll(predicate.getFields());
			}
			return result;
		}

		@Nullable
		@Override
		public Boolean test(Record record) {
			boolean unknown = false;
			for (RecordPredicate predicate : predicates) {
				Boolean result = predicate.test(record);
				if (result == null) {
					unknown = true;
				} else if (!result) {
					return Boolean.FALSE;
				}
			}
			return unknown ? null : Boolean.TRUE;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateAnd that = (PredicateAnd) o;

			return new HashSet<>(predicates).equals(new HashSet<>(that.predicates));
		}

		@Override
		public int hashCode() {
			return new HashSet<>(predicates).hashCode();
		}

		@Override
		public String toString() {
			return "(" + JOINER.join(predicates) + ")";
		}
	}

	public static final class PredicateOr implements RecordPredicate {
		static final Joiner JOINER = Joiner.on(" OR ");
		final List<RecordPredicate> predicates;

		PredicateOr(List<RecordPredicate> predicates) {
			this.predicates = predicates;
		}

		public List<RecordPredicate> getPredicates() {
			return predicates;
		}

		@Override
		public RecordPredicate simplify() {
			Set<RecordPredicate> simplifiedPredicates = newLinkedHashSet();
			for (RecordPredicate predicate : predicates) {
				RecordPredicate simplified = predicate.simplify();
				if (simplified == alwaysTrue())
					return alwaysTrue();
				if (simplified == alwaysFalse())
					continue;
				if (simplified instanceof PredicateOr) {
					simplifiedPredicates.addAll(((PredicateOr) simplified).predicates);
				} else {
					simplifiedPredicates.add(simplified);
				}
			}
			return simplifiedPredicates.isEmpty() ?
					alwaysFalse() :
					simplifiedPredicates.size() == 1 ?
							simplifiedPredicates.iterator().next() :
							or(newArrayList(simplifiedPredicates));
		}

		@Override
		public Set<String> getFields() {
			Set<String> result = new LinkedHashSet<>();
			for (RecordPredicate predicate : predicates) {
				result.addAll(predicate.getFields());
			}
			return result;
		}

		@Nullable
		@Override
		public Boolean test(Record record) {
			boolean unknown = false;
			for (RecordPredicate predicate : predicates) {
				Boolean result = predicate.test(record);
				if (result == null) {
					unknown = true;
				} else if (result) {
					return Boolean.TRUE;
				}
			}
			return unknown ? null : Boolean.FALSE;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			PredicateOr that = (PredicateOr) o;

			return new HashSet<>(predicates).equals(new HashSet<>(that.predicates));
		}

		@Override
		public int hashCode() {
			return new HashSet<>(predicates).hashCode();
		}

		@Override
		public String toString() {
			return "(" + JOINER.join(predicates) + ")";
		}
	}

	public static RecordPredicate alwaysTrue() {
		return PredicateAlwaysTrue.instance;
	}

	public static RecordPredicate alwaysFalse() {
		return PredicateAlwaysFalse.instance;
	}

	public static RecordPredicate not(RecordPredicate predicate) {
		return new PredicateNot(checkNotNull(predicate));
	}

	public static RecordPredicate and(List<RecordPredicate> predicates) {
		return new PredicateAnd(predicates);
	}

	public static RecordPredicate and(RecordPredicate... predicates) {
		return and(Arrays.asList(predicates));
	}

	public static RecordPredicate or(List<RecordPredicate> predicates) {
		return new PredicateOr(predicates);
	}

	public static RecordPredicate or(RecordPredicate... predicates) {
		return or(Arrays.asList(predicates));
	}

	public static RecordPredicate eq(String key, Object value) {
		return new PredicateEq(checkNotNull(key), checkNotNull(value, "Use isNull() to match missing values"));
	}

	public static RecordPredicate notEq(String key, Object value) {
		return new PredicateNotEq(checkNotNull(key), checkNotNull(value, "Use not(isNull()) to match present values"));
	}

	public static RecordPredicate in(String key, Collection<?> values) {
		Set<Object> set = new LinkedHashSet<>();
		for (Object value : values) {
			set.add(checkNotNull(value));
		}
		return new PredicateIn(checkNotNull(key), set);
	}

	public static RecordPredicate in(String key, Object... values) {
		return in(key, Arrays.asList(values));
	}

	public static RecordPredicate isNull(String key) {
		return new PredicateIsNull(checkNotNull(key));
	}

	public static RecordPredicate regexp(String key, String pattern) {
		return new PredicateRegexp(checkNotNull(key), pattern);
	}

	public static RecordPredicate between(String key, Comparable<?> from, Comparable<?> to) {
		return new PredicateBetween(checkNotNull(key), checkNotNull(from), checkNotNull(to));
	}
}
