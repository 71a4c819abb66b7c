package dtm.strata.storage.containers;

import dtm.strata.core.DependencyContainer;
import dtm.strata.core.ScopedDependencyContainer;
import dtm.strata.exceptions.DependencyFinalizationException;
import dtm.strata.prototypes.*;
import dtm.strata.storage.ResolutionChain;
import dtm.strata.utils.FutureUtils;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Contêiner com escopo, pai opcional e filhos mantidos por referência fraca.
 * <p>
 * O pai apenas conhece os filhos para destruí-los em cascata; ele não os mantém vivos.
 * Um filho descartado pelo chamador sem destroy pode ser coletado normalmente.
 * <p>
 * Um escopo destruído é definitivo: {@code get}, {@code register}, {@code child} e {@code merge}
 * passam a falhar com {@link dtm.strata.exceptions.ContainerDestroyedException}.
 */
@Slf4j
public class ScopedDependencyContainerStorage extends DependencyContainerStorage implements ScopedDependencyContainer {

    @Getter
    private final String scope;

    private volatile ScopedDependencyContainerStorage parent;
    private final List<WeakReference<ScopedDependencyContainerStorage>> children;
    private final AtomicBoolean closing;

    protected ScopedDependencyContainerStorage(ScopedDependencyContainerStorage parent, @NonNull String scope) {
        super();
        this.parent = parent;
        this.scope = scope;
        this.children = new ArrayList<>();
        this.closing = new AtomicBoolean(false);
    }

    /**
     * Cria um escopo raiz, sem pai.
     */
    public static ScopedDependencyContainerStorage create(@NonNull String scope){
        return new ScopedDependencyContainerStorage(null, scope);
    }

    /**
     * Converte um contêiner qualquer em um escopo raiz com os mesmos registros.
     */
    public static ScopedDependencyContainerStorage scoped(@NonNull DependencyContainer container, @NonNull String scope){
        return create(scope).merge(container);
    }

    @Override
    public Optional<ScopedDependencyContainer> getParent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public <T> ScopedDependencyContainerStorage register(Dependency<T> dependency) {
        super.register(dependency);
        return this;
    }

    @Override
    public <T> ScopedDependencyContainerStorage register(Tag<T> tag, Factory<T> factory) {
        super.register(tag, factory);
        return this;
    }

    @Override
    public <T> ScopedDependencyContainerStorage register(Tag<T> tag, Factory<T> factory, Finalizer<T> finalizer) {
        super.register(tag, factory, finalizer);
        return this;
    }

    @Override
    public <T> ScopedDependencyContainerStorage registerAsync(Tag<T> tag, AsyncFactory<T> factory) {
        super.registerAsync(tag, factory);
        return this;
    }

    @Override
    public <T> ScopedDependencyContainerStorage registerAsync(Tag<T> tag, AsyncFactory<T> factory, AsyncFinalizer<T> finalizer) {
        super.registerAsync(tag, factory, finalizer);
        return this;
    }

    @Override
    public <T> CompletableFuture<T> resolve(@NonNull Tag<T> tag, @NonNull ResolutionChain chain) {
        final ScopedDependencyContainerStorage currentParent = parent;
        if(hasOwnRegistration(tag) || currentParent == null){
            return super.resolve(tag, chain);
        }
        log.debug("Dependência {} não registrada no escopo '{}', delegando ao escopo '{}'", tag.getId(), scope, currentParent.getScope());
        return currentParent.resolve(tag, chain);
    }

    @Override
    public boolean has(@NonNull Tag<?> tag) {
        if(super.has(tag)) return true;
        final ScopedDependencyContainerStorage currentParent = parent;
        return currentParent != null && currentParent.has(tag);
    }

    @Override
    public boolean exists(@NonNull Tag<?> tag) {
        if(super.exists(tag)) return true;
        final ScopedDependencyContainerStorage currentParent = parent;
        return currentParent != null && currentParent.exists(tag);
    }

    @Override
    public ScopedDependencyContainerStorage child(@NonNull String scope) {
        synchronized (lock){
            if(closing.get() || isDestroyed()){
                throw destroyedException("criar o escopo filho '" + scope + "'");
            }
            ScopedDependencyContainerStorage child = new ScopedDependencyContainerStorage(this, scope);
            if(isFailureCachingEnabled()){
                child.enableFailureCaching();
            }else{
                child.disableFailureCaching();
            }
            purgeCollectedChildren();
            children.add(new WeakReference<>(child));
            log.debug("Escopo '{}' criado como filho de '{}'", scope, this.scope);
            return child;
        }
    }

    @Override
    public CompletableFuture<Void> destroyAsync() {
        if(!closing.compareAndSet(false, true)){
            return CompletableFuture.completedFuture(null);
        }

        final List<ScopedDependencyContainerStorage> liveChildren = getLiveChildren();
        log.debug("Destruindo escopo '{}' ({} escopos filhos ativos)", scope, liveChildren.size());

        List<CompletableFuture<Void>> childTasks = new ArrayList<>(liveChildren.size());
        for (ScopedDependencyContainerStorage child : liveChildren){
            childTasks.add(FutureUtils.invokeSafely(child::destroyAsync));
        }

        return FutureUtils.settle(childTasks)
                .thenCompose(childFailures -> super.destroyAsync()
                        .handle((ignored, error) -> {
                            List<Throwable> failures = new ArrayList<>();
                            childFailures.forEach(failure -> collectFailure(failures, failure));
                            if(error != null){
                                collectFailure(failures, FutureUtils.unwrap(error));
                            }
                            return failures;
                        }))
                .thenCompose(failures -> {
                    detachFromParent();
                    if(failures.isEmpty()){
                        return CompletableFuture.completedFuture(null);
                    }
                    return CompletableFuture.failedFuture(new DependencyFinalizationException(failures));
                });
    }

    @Override
    public ScopedDependencyContainerStorage merge(@NonNull DependencyContainer other) {
        return (ScopedDependencyContainerStorage) super.merge(other);
    }

    @Override
    protected DependencyContainerStorage newEmptyContainer() {
        return new ScopedDependencyContainerStorage(null, scope);
    }

    @Override
    protected String describe() {
        return "escopo '" + scope + "'";
    }

    List<ScopedDependencyContainerStorage> getLiveChildren(){
        synchronized (lock){
            purgeCollectedChildren();
            List<ScopedDependencyContainerStorage> live = new ArrayList<>(children.size());
            for (WeakReference<ScopedDependencyContainerStorage> reference : children){
                ScopedDependencyContainerStorage child = reference.get();
                if(child != null) live.add(child);
            }
            return live;
        }
    }

    private void removeChild(ScopedDependencyContainerStorage child){
        synchronized (lock){
            children.removeIf(reference -> {
                ScopedDependencyContainerStorage current = reference.get();
                return current == null || current == child;
            });
        }
    }

    private void purgeCollectedChildren(){
        Iterator<WeakReference<ScopedDependencyContainerStorage>> iterator = children.iterator();
        while (iterator.hasNext()){
            if(iterator.next().get() == null) iterator.remove();
        }
    }

    private void detachFromParent(){
        final ScopedDependencyContainerStorage currentParent = parent;
        if(currentParent != null){
            currentParent.removeChild(this);
            parent = null;
        }
    }

    private static void collectFailure(List<Throwable> failures, Throwable failure){
        if(failure instanceof DependencyFinalizationException finalizationException){
            failures.addAll(finalizationException.getErrors());
        }else{
            failures.add(failure);
        }
    }
}
