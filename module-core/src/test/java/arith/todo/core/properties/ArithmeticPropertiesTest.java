package arith.todo.core.properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import arith.todo.core.context.CallContext;
import arith.todo.core.port.out.ToDoStore;
import arith.todo.core.service.BasicArithmeticToDoService;
import arith.todo.error.exception.IntOverflowException;
import arith.todo.error.exception.MaxSizeExceededException;
import net.jqwik.api.Assume;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.StringLength;

/**
 * 연산 불변식(Property-Based) 테스트
 *
 * <ol>
 *   <li>Sum: 결과가 int 범위에 들어오면 정확한 합, 벗어나면 IntOverflow
 *   <li>Concat: 결과 길이가 한도 이하면 그대로 이어 붙이고, 넘으면 MaxSizeExceeded
 * </ol>
 */
class ArithmeticPropertiesTest {

  private final BasicArithmeticToDoService service =
      new BasicArithmeticToDoService(mock(ToDoStore.class));
  private final CallContext ctx = CallContext.background();

  @Property(tries = 200)
  void sum_matches_long_arithmetic(@ForAll int a, @ForAll int b) {
    Assume.that(a != 0 || b != 0);

    long exact = (long) a + b;
    if (exact > Integer.MAX_VALUE || exact < Integer.MIN_VALUE) {
      assertThatThrownBy(() -> service.sum(ctx, a, b)).isInstanceOf(IntOverflowException.class);
    } else {
      assertThat(service.sum(ctx, a, b)).isEqualTo((int) exact);
    }
  }

  @Property(tries = 100)
  void sum_is_commutative(@ForAll int a, @ForAll int b) {
    Assume.that(a != 0 || b != 0);
    Assume.that(Math.abs((long) a + b) <= Integer.MAX_VALUE);

    assertThat(service.sum(ctx, a, b)).isEqualTo(service.sum(ctx, b, a));
  }

  @Property(tries = 200)
  void concat_respects_max_length(
      @ForAll @StringLength(max = 12) String a, @ForAll @StringLength(max = 12) String b) {
    if (a.length() + b.length() > BasicArithmeticToDoService.MAX_CONCAT_LENGTH) {
      assertThatThrownBy(() -> service.concat(ctx, a, b))
          .isInstanceOf(MaxSizeExceededException.class);
    } else {
      assertThat(service.concat(ctx, a, b)).isEqualTo(a + b).startsWith(a).endsWith(b);
    }
  }
}
