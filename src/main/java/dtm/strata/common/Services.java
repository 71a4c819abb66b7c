package dtm.strata.common;

import dtm.strata.core.Layer;
import dtm.strata.prototypes.*;
import lombok.NonNull;

/**
 * Cria layers a partir de um {@link ServiceTag}: o layer exige as dependências declaradas no tag
 * e fornece o próprio tag.
 * <pre>{@code
 * ServiceTag<UserRepository> USER_REPOSITORY = Tag.service(UserRepository.class, DATABASE);
 *
 * Layer repository = Services.service(USER_REPOSITORY, c -> new UserRepository(c.get(DATABASE)));
 * }</pre>
 * A factory deve resolver apenas os tags declarados no {@link ServiceTag}; o manifesto não é
 * inferido a partir do corpo da factory.
 */
public final class Services {

    private Services() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static <T> Layer service(@NonNull ServiceTag<T> tag, @NonNull Factory<T> factory){
        return serviceAsync(tag, AsyncFactory.of(factory), null);
    }

    public static <T> Layer service(@NonNull ServiceTag<T> tag, @NonNull Factory<T> factory, @NonNull Finalizer<T> finalizer){
        return serviceAsync(tag, AsyncFactory.of(factory), AsyncFinalizer.of(finalizer));
    }

    public static <T> Layer serviceAsync(@NonNull ServiceTag<T> tag, @NonNull AsyncFactory<T> factory){
        return serviceAsync(tag, factory, null);
    }

    public static <T> Layer serviceAsync(@NonNull ServiceTag<T> tag, @NonNull AsyncFactory<T> factory, AsyncFinalizer<T> finalizer){
        return Layers.define()
                .named(tag.getId())
                .requires(tag.getDependencies().toArray(new Tag<?>[0]))
                .provides(tag)
                .register(container -> container.registerAsync(tag, factory, finalizer));
    }
}
