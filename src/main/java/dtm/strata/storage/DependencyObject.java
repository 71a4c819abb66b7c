package dtm.strata.storage;

import dtm.strata.prototypes.AsyncFactory;
import dtm.strata.prototypes.AsyncFinalizer;
import dtm.strata.prototypes.Dependency;
import dtm.strata.prototypes.Tag;
import lombok.*;

@Getter
@ToString
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
public class DependencyObject<T> extends Dependency<T> {
    @NonNull
    private final Tag<T> tag;

    @NonNull
    @ToString.Exclude
    private final AsyncFactory<T> factory;

    @ToString.Exclude
    private final AsyncFinalizer<T> finalizer;

}
