package parallelizer.util;

import java.util.Optional;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/** Either S or T */
public class Either<S, T> {
  public final Optional<S> s;
  public final Optional<T> t;

  public Either(@Nullable S s, @Nullable T t) {
    assert (s == null) != (t == null);
    this.s = Optional.ofNullable(s);
    this.t = Optional.ofNullable(t);
  }

  public static <S, T> Either<S, T> first(S s) {
    return new Either<>(s, null);
  }

  public static <S, T> Either<S, T> second(T t) {
    return new Either<>(null, t);
  }

  public <R> R fold(Function<? super S, ? extends R> onS, Function<? super T, ? extends R> onT) {
    return s.isPresent() ? onS.apply(s.get()) : onT.apply(t.get());
  }
}
