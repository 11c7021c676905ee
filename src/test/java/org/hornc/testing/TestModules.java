/*
 * Copyright 2026 The Hornc Authors
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

package org.hornc.testing;

import com.google.common.collect.ImmutableList;
import org.hornc.code.Machine;
import org.hornc.hlds.ConsId;
import org.hornc.hlds.Determinism;
import org.hornc.hlds.GoalBuilder;
import org.hornc.hlds.HigherOrder;
import org.hornc.hlds.Inst;
import org.hornc.hlds.Mode;
import org.hornc.hlds.ModuleTable;
import org.hornc.hlds.PredId;
import org.hornc.hlds.PredInfo;
import org.hornc.hlds.TypeDefn;
import org.hornc.hlds.Var;

/**
 * Small predicates used by tests throughout the compiler, written the way a front end would hand
 * them over: one clause per predicate with the alternatives as a disjunction, and modes declared.
 */
public final class TestModules {
  public static final ConsId NIL = ConsId.of("[]", 0);
  public static final ConsId CONS = ConsId.of("[|]", 2);
  public static final TypeDefn LIST = new TypeDefn("list", NIL, CONS);

  public static final ConsId RED = ConsId.of("red", 0);
  public static final ConsId GREEN = ConsId.of("green", 0);
  public static final ConsId BLUE = ConsId.of("blue", 0);
  public static final ConsId YELLOW = ConsId.of("yellow", 0);
  public static final TypeDefn COLOUR = new TypeDefn("colour", RED, GREEN, BLUE, YELLOW);

  public static final ConsId YES = ConsId.of("yes", 0);
  public static final ConsId NO = ConsId.of("no", 0);
  public static final TypeDefn BOOL = new TypeDefn("bool", YES, NO);

  public static final ConsId PAIR = ConsId.of("pair", 2);
  public static final ConsId TAG = ConsId.of("tag", 1);

  /** The higher-order inst of a closure that maps one ground value to another. */
  public static final HigherOrder IN_OUT_DET =
      new HigherOrder(ImmutableList.of(Mode.IN, Mode.OUT), Determinism.DET);

  public static final Mode CLOSURE_IN =
      new Mode(Inst.closure(IN_OUT_DET), Inst.closure(IN_OUT_DET));

  public static final PredId APPEND = PredId.of("append", 3);
  public static final PredId MEMBER = PredId.of("member", 2);
  public static final PredId CONTAINS = PredId.of("contains", 2);
  public static final PredId LAST = PredId.of("last", 2);
  public static final PredId NEXT = PredId.of("next", 2);
  public static final PredId WARM = PredId.of("warm", 1);
  public static final PredId IS_RED = PredId.of("is_red", 2);
  public static final PredId LESS_THAN = PredId.of("less_than", 2);
  public static final PredId PLUS = PredId.of("plus", 3);
  public static final PredId MAX = PredId.of("max", 3);
  public static final PredId MAX3 = PredId.of("max3", 4);
  public static final PredId SUM = PredId.of("sum", 3);
  public static final PredId TAG_REVERSE = PredId.of("tag_reverse", 4);
  public static final PredId MAP = PredId.of("map", 3);
  public static final PredId PREFIX_ALL = PredId.of("prefix_all", 3);

  private TestModules() {}

  /**
   * <pre>
   * append(A, B, C) :- (A = [], C = B ; A = [H|T], C = [H|T2], append(T, B, T2)).
   * :- mode append(in, in, out) is det.
   * :- mode append(out, out, in) is multi.
   * </pre>
   *
   * The second mode needs its second disjunct reordered.
   */
  public static PredInfo append() {
    GoalBuilder b = new GoalBuilder().at("append.m", 1);
    Var a = b.var("A", LIST);
    Var bv = b.var("B", LIST);
    Var c = b.var("C", LIST);
    Var h = b.var("H");
    Var t = b.var("T", LIST);
    Var t2 = b.var("T2", LIST);
    return PredInfo.builder("append")
        .clause(
            ImmutableList.of(a, bv, c),
            b.disj(
                b.conj(b.unify(a, NIL), b.unify(c, bv)),
                b.conj(
                    b.unify(a, CONS, h, t), b.unify(c, CONS, h, t2), b.call(APPEND, t, bv, t2))))
        .mode(Determinism.DET, Mode.IN, Mode.IN, Mode.OUT)
        .mode(Determinism.MULTI, Mode.OUT, Mode.OUT, Mode.IN)
        .build();
  }

  /**
   * <pre>
   * member(X, L) :- L = [H|T], (X = H ; member(X, T)).
   * :- mode member(out, in) is nondet.
   * </pre>
   */
  public static PredInfo member() {
    GoalBuilder b = new GoalBuilder().at("member.m", 1);
    Var x = b.var("X");
    Var l = b.var("L", LIST);
    Var h = b.var("H");
    Var t = b.var("T", LIST);
    return PredInfo.builder("member")
        .clause(
            ImmutableList.of(x, l),
            b.conj(b.unify(l, CONS, h, t), b.disj(b.unify(x, h), b.call(MEMBER, x, t))))
        .mode(Determinism.NONDET, Mode.OUT, Mode.IN)
        .build();
  }

  /**
   * <pre>
   * contains(X, L) :- commit(member(Y, L), Y = X).
   * :- mode contains(in, in) is semidet.
   * </pre>
   */
  public static PredInfo contains() {
    GoalBuilder b = new GoalBuilder().at("contains.m", 1);
    Var x = b.var("X");
    Var l = b.var("L", LIST);
    Var y = b.var("Y");
    return PredInfo.builder("contains")
        .clause(ImmutableList.of(x, l), b.commit(b.conj(b.call(MEMBER, y, l), b.unify(y, x))))
        .mode(Determinism.SEMIDET, Mode.IN, Mode.IN)
        .build();
  }

  /**
   * <pre>
   * last(L, X) :- L = [H|T], (T = [], X = H ; T = [_|_], last(T, X)).
   * :- mode last(in, out).
   * </pre>
   *
   * The determinism (semidet) is left to be inferred.
   */
  public static PredInfo last() {
    GoalBuilder b = new GoalBuilder().at("last.m", 1);
    Var l = b.var("L", LIST);
    Var x = b.var("X");
    Var h = b.var("H");
    Var t = b.var("T", LIST);
    Var h2 = b.var("H2");
    Var t2 = b.var("T2", LIST);
    return PredInfo.builder("last")
        .clause(
            ImmutableList.of(l, x),
            b.conj(
                b.unify(l, CONS, h, t),
                b.disj(
                    b.conj(b.unify(t, NIL), b.unify(x, h)),
                    b.conj(b.unify(t, CONS, h2, t2), b.call(LAST, t, x)))))
        .mode(null, Mode.IN, Mode.OUT)
        .build();
  }

  /**
   * <pre>
   * next(C, D) :- (C = red, D = green ; C = green, D = blue
   *               ; C = blue, D = yellow ; C = yellow, D = red).
   * :- mode next(in, out) is det.
   * </pre>
   */
  public static PredInfo next() {
    GoalBuilder b = new GoalBuilder().at("colour.m", 1);
    Var c = b.var("C", COLOUR);
    Var d = b.var("D", COLOUR);
    return PredInfo.builder("next")
        .clause(
            ImmutableList.of(c, d),
            b.disj(
                b.conj(b.unify(c, RED), b.unify(d, GREEN)),
                b.conj(b.unify(c, GREEN), b.unify(d, BLUE)),
                b.conj(b.unify(c, BLUE), b.unify(d, YELLOW)),
                b.conj(b.unify(c, YELLOW), b.unify(d, RED))))
        .mode(Determinism.DET, Mode.IN, Mode.OUT)
        .build();
  }

  /**
   * <pre>
   * warm(C) :- (C = red ; C = yellow).
   * :- mode warm(in) is semidet.
   * </pre>
   */
  public static PredInfo warm() {
    GoalBuilder b = new GoalBuilder().at("colour.m", 10);
    Var c = b.var("C", COLOUR);
    return PredInfo.builder("warm")
        .clause(ImmutableList.of(c), b.disj(b.unify(c, RED), b.unify(c, YELLOW)))
        .mode(Determinism.SEMIDET, Mode.IN)
        .build();
  }

  /**
   * <pre>
   * is_red(C, B) :- (if C = red then B = yes else B = no).
   * :- mode is_red(in, out) is det.
   * </pre>
   */
  public static PredInfo isRed() {
    GoalBuilder b = new GoalBuilder().at("colour.m", 20);
    Var c = b.var("C", COLOUR);
    Var r = b.var("B", BOOL);
    return PredInfo.builder("is_red")
        .clause(
            ImmutableList.of(c, r), b.ite(b.unify(c, RED), b.unify(r, YES), b.unify(r, NO)))
        .mode(Determinism.DET, Mode.IN, Mode.OUT)
        .build();
  }

  /** {@code :- mode less_than(in, in) is semidet}, implemented by foreign code. */
  public static PredInfo lessThan() {
    return PredInfo.builder("less_than")
        .foreign("less_than")
        .mode(Determinism.SEMIDET, Mode.IN, Mode.IN)
        .build();
  }

  /** {@code :- mode plus(in, in, out) is det}, implemented by foreign code. */
  public static PredInfo plus() {
    return PredInfo.builder("plus")
        .foreign("plus")
        .mode(Determinism.DET, Mode.IN, Mode.IN, Mode.OUT)
        .build();
  }

  /**
   * <pre>
   * max(X, Y, Z) :- (if less_than(X, Y) then Z = Y else Z = X).
   * :- mode max(in, in, out) is det.
   * </pre>
   */
  public static PredInfo max() {
    GoalBuilder b = new GoalBuilder().at("max.m", 1);
    Var x = b.var("X");
    Var y = b.var("Y");
    Var z = b.var("Z");
    return PredInfo.builder("max")
        .clause(
            ImmutableList.of(x, y, z),
            b.ite(b.call(LESS_THAN, x, y), b.unify(z, y), b.unify(z, x)))
        .mode(Determinism.DET, Mode.IN, Mode.IN, Mode.OUT)
        .build();
  }

  /**
   * <pre>
   * max3(A, B, C, M) :- max(A, B, M1), max(M1, C, M).
   * :- mode max3(in, in, in, out) is det.
   * </pre>
   */
  public static PredInfo max3() {
    GoalBuilder b = new GoalBuilder().at("max.m", 10);
    Var a = b.var("A");
    Var bv = b.var("B");
    Var c = b.var("C");
    Var m = b.var("M");
    Var m1 = b.var("M1");
    return PredInfo.builder("max3")
        .clause(
            ImmutableList.of(a, bv, c, m), b.conj(b.call(MAX, a, bv, m1), b.call(MAX, m1, c, m)))
        .mode(Determinism.DET, Mode.IN, Mode.IN, Mode.IN, Mode.OUT)
        .build();
  }

  /**
   * <pre>
   * sum(L, Acc, S) :- (L = [], S = Acc ; L = [H|T], plus(Acc, H, Acc1), sum(T, Acc1, S)).
   * :- mode sum(in, in, out) is det.
   * </pre>
   */
  public static PredInfo sum() {
    GoalBuilder b = new GoalBuilder().at("sum.m", 1);
    Var l = b.var("L", LIST);
    Var acc = b.var("Acc");
    Var s = b.var("S");
    Var h = b.var("H");
    Var t = b.var("T", LIST);
    Var acc1 = b.var("Acc1");
    return PredInfo.builder("sum")
        .clause(
            ImmutableList.of(l, acc, s),
            b.disj(
                b.conj(b.unify(l, NIL), b.unify(s, acc)),
                b.conj(
                    b.unify(l, CONS, h, t),
                    b.call(PLUS, acc, h, acc1),
                    b.call(SUM, t, acc1, s))))
        .mode(Determinism.DET, Mode.IN, Mode.IN, Mode.OUT)
        .build();
  }

  /**
   * <pre>
   * tag_reverse(K, L, Acc, R) :-
   *     W = tag(K),
   *     (L = [], R = Acc ; L = [H|T], P = pair(W, H), Acc1 = [P|Acc], tag_reverse(K, T, Acc1, R)).
   * :- mode tag_reverse(in, in, in, out) is det.
   * </pre>
   *
   * K is the same in every recursive call, and W depends only on K.
   */
  public static PredInfo tagReverse() {
    GoalBuilder b = new GoalBuilder().at("tag.m", 1);
    Var k = b.var("K");
    Var l = b.var("L", LIST);
    Var acc = b.var("Acc", LIST);
    Var r = b.var("R", LIST);
    Var w = b.var("W");
    Var h = b.var("H");
    Var t = b.var("T", LIST);
    Var p = b.var("P");
    Var acc1 = b.var("Acc1", LIST);
    return PredInfo.builder("tag_reverse")
        .clause(
            ImmutableList.of(k, l, acc, r),
            b.conj(
                b.unify(w, TAG, k),
                b.disj(
                    b.conj(b.unify(l, NIL), b.unify(r, acc)),
                    b.conj(
                        b.unify(l, CONS, h, t),
                        b.unify(p, PAIR, w, h),
                        b.unify(acc1, CONS, p, acc),
                        b.call(TAG_REVERSE, k, t, acc1, r)))))
        .mode(Determinism.DET, Mode.IN, Mode.IN, Mode.IN, Mode.OUT)
        .build();
  }

  /**
   * <pre>
   * map(P, L, M) :- (L = [], M = [] ; L = [H|T], P(H, H2), map(P, T, T2), M = [H2|T2]).
   * :- mode map(pred(in, out) is det, in, out) is det.
   * </pre>
   */
  public static PredInfo map() {
    GoalBuilder b = new GoalBuilder().at("map.m", 1);
    Var p = b.var("P");
    Var l = b.var("L", LIST);
    Var m = b.var("M", LIST);
    Var h = b.var("H");
    Var t = b.var("T", LIST);
    Var h2 = b.var("H2");
    Var t2 = b.var("T2", LIST);
    return PredInfo.builder("map")
        .clause(
            ImmutableList.of(p, l, m),
            b.disj(
                b.conj(b.unify(l, NIL), b.unify(m, NIL)),
                b.conj(
                    b.unify(l, CONS, h, t),
                    b.callClosure(p, h, h2),
                    b.call(MAP, p, t, t2),
                    b.unify(m, CONS, h2, t2))))
        .mode(Determinism.DET, CLOSURE_IN, Mode.IN, Mode.OUT)
        .build();
  }

  /**
   * <pre>
   * prefix_all(Pre, Ls, Ms) :- P = append(Pre), map(P, Ls, Ms).
   * :- mode prefix_all(in, in, out) is det.
   * </pre>
   */
  public static PredInfo prefixAll() {
    GoalBuilder b = new GoalBuilder().at("map.m", 10);
    Var pre = b.var("Pre", LIST);
    Var ls = b.var("Ls", LIST);
    Var ms = b.var("Ms", LIST);
    Var p = b.var("P");
    return PredInfo.builder("prefix_all")
        .clause(
            ImmutableList.of(pre, ls, ms),
            b.conj(b.closure(p, APPEND, pre), b.call(MAP, p, ls, ms)))
        .mode(Determinism.DET, Mode.IN, Mode.IN, Mode.OUT)
        .build();
  }

  /** Returns the list with the given elements, as {@link Machine} represents it. */
  public static Machine.Term list(Object... elements) {
    Machine.Term result = Machine.Term.of(NIL);
    for (int i = elements.length - 1; i >= 0; i--) {
      result = Machine.Term.of(CONS, elements[i], result);
    }
    return result;
  }

  /** Returns a module containing the given predicates. */
  public static ModuleTable module(PredInfo... preds) {
    ModuleTable.Builder builder = ModuleTable.builder();
    for (PredInfo pred : preds) {
      builder.add(pred);
    }
    return builder.build();
  }

  /** Returns a module containing every predicate defined here. */
  public static ModuleTable standard() {
    return module(
        append(),
        member(),
        contains(),
        last(),
        next(),
        warm(),
        isRed(),
        lessThan(),
        plus(),
        max(),
        max3(),
        sum(),
        tagReverse(),
        map(),
        prefixAll());
  }
}
