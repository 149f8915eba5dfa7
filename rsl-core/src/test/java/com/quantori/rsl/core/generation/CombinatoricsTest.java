package com.quantori.rsl.core.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class CombinatoricsTest {

  @Test
  void productVariesLastSlotFastest() {
    assertThat(Combinatorics.product(List.of("a", "b"), 2)).containsExactly(
        List.of("a", "a"), List.of("a", "b"), List.of("b", "a"), List.of("b", "b"));
  }

  @Test
  void productSizeIsChoicesToThePowerOfRepeat() {
    assertThat(Combinatorics.product(List.of(1, 2, 3), 3)).hasSize(27).doesNotHaveDuplicates();
  }

  @Test
  void zeroRepeatYieldsSingleEmptyTuple() {
    assertThat(Combinatorics.product(List.of(1, 2), 0)).containsExactly(List.of());
    assertThat(Combinatorics.product(List.of(), 2)).isEmpty();
    assertThatThrownBy(() -> Combinatorics.product(List.of(1), -1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void combinationsAreLexicographic() {
    assertThat(Combinatorics.combinations(List.of(0, 1, 3, 4), 3)).containsExactly(
        List.of(0, 1, 3), List.of(0, 1, 4), List.of(0, 3, 4), List.of(1, 3, 4));
  }

  @Test
  void combinationsOfTooManyElementsAreEmpty() {
    assertThat(Combinatorics.combinations(List.of(1, 2), 3)).isEmpty();
    assertThat(Combinatorics.combinations(List.of(1, 2), 0)).containsExactly(List.of());
  }
}
