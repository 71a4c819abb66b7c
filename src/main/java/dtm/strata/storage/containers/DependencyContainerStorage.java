package dtm.strata.storage.containers;

import dtm.strata.core.DependencyContainer;
import dtm.strata.exceptions.*;
import dtm.strata.prototypes.*;
import dtm.strata.storage.ChainedDependencyGetter;
import dtm.strata.storage.DependencyObject;
import dtm.strata.storage.ResolutionChain;
import dtm.strata.utils.FutureUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Contêiner básico: registros, cache de instâncias e ciclo de vida de um conjunto plano de tags.
 * <p>
 * O estado (registros, cache e flag de destruição) é protegido pelo monitor {@code lock}.
 * A factory nunca executa dentro do monitor: o future pendente é instalado no cache antes,
 * e é isso que garante a criação única mesmo com acessos concorrentes.
 */
@Slf4j
@SuppressWarnings("unchecked")
public class DependencyContainerStorage implements DependencyContainer, ChainedDependencyGetter.ChainResolver {

    protected final Object lock = new Object();

    private final Map<Tag<?>, Dependency<?>> dependencyContainer;
    private final Map<Tag<?>, CompletableFuture<Object>> instances;
    private boolean destroyed;
    private volatile boolean failureCaching;

    protected DependencyContainerStorage() {
        this.dependencyContainer = new LinkedHashMap<>();
        this.instances = new LinkedHashMap<>();
        this.destroyed = false;
        this.failureCaching = true;
    }

    public static DependencyContainerStorage create(){
        return new DependencyContainerStorage();
    }

    @Override
    public <T> DependencyContainer register(@NonNull Dependency<T> dependency) {
        registerInContainer(dependency);
        return this;
    }

    @Override
    public <T> DependencyContainer register(Tag<T> tag, Factory<T> factory) {
        return register(tag, factory, null);
    }

    @Override
    public <T> DependencyContainer register(Tag<T> tag, Factory<T> factory, Finalizer<T> finalizer) {
        return registerAsync(tag, AsyncFactory.of(factory), (finalizer != null) ? AsyncFinalizer.of(finalizer) : null);
    }

    @Override
    public <T> DependencyContainer registerAsync(Tag<T> tag, AsyncFactory<T> factory) {
        return registerAsync(tag, factory, null);
    }

    @Override
    public <T> DependencyContainer registerAsync(Tag<T> tag, AsyncFactory<T> factory, AsyncFinalizer<T> finalizer) {
        return register(DependencyObject.<T>builder()
                .tag(tag)
                .factory(factory)
                .finalizer(finalizer)
                .build());
    }

    @Override
    public <T> CompletableFuture<T> getAsync(@NonNull Tag<T> tag) {
        return resolve(tag, ResolutionChain.empty());
    }

    @Override
    public <T> CompletableFuture<T> resolve(@NonNull Tag<T> tag, @NonNull ResolutionChain chain) {
        Dependency<T> dependency = null;
        CompletableFuture<Object> creation = null;
        CircularDependencyException cycle = null;

        synchronized (lock){
            CompletableFuture<Object> cached = instances.get(tag);
            if(cached != null && cached.isDone()){
                return (CompletableFuture<T>) cached.copy();
            }
            if(chain.contains(tag)){
                // o tag ainda está em criação neste mesmo caminho
                cycle = new CircularDependencyException(tag, chain.getTags());
            }else if(cached != null){
                return (CompletableFuture<T>) cached.copy();
            }else if(destroyed){
                return CompletableFuture.failedFuture(destroyedException("resolver " + tag.getId()));
            }else{
                dependency = (Dependency<T>) dependencyContainer.get(tag);
                if(dependency == null){
                    return CompletableFuture.failedFuture(new UnknownDependencyException(tag));
                }
                creation = new CompletableFuture<>();
                instances.put(tag, creation);
            }
        }

        if(cycle != null){
            logCycle(cycle);
            return CompletableFuture.failedFuture(cycle);
        }

        createInstance(dependency, chain.append(tag), creation);
        return (CompletableFuture<T>) creation.copy();
    }

    @Override
    public boolean has(@NonNull Tag<?> tag) {
        synchronized (lock){
            return dependencyContainer.containsKey(tag);
        }
    }

    @Override
    public boolean exists(@NonNull Tag<?> tag) {
        CompletableFuture<Object> cached;
        synchronized (lock){
            cached = instances.get(tag);
        }
        return cached != null && cached.isDone() && !cached.isCompletedExceptionally();
    }

    @Override
    public CompletableFuture<Void> destroyAsync() {
        final Map<Tag<?>, CompletableFuture<Object>> created;
        final Map<Tag<?>, Dependency<?>> registrations;

        synchronized (lock){
            if(destroyed) return CompletableFuture.completedFuture(null);
            destroyed = true;
            created = new LinkedHashMap<>(instances);
            registrations = new LinkedHashMap<>(dependencyContainer);
        }

        log.debug("Destruindo contêiner {} ({} instâncias criadas)", describe(), created.size());

        return runFinalizers(created, registrations)
                .handle((failures, error) -> {
                    synchronized (lock){
                        instances.clear();
                        dependencyContainer.clear();
                    }
                    if(error != null){
                        return List.of(FutureUtils.unwrap(error));
                    }
                    return failures;
                })
                .thenCompose(failures -> {
                    if(failures.isEmpty()){
                        log.debug("Contêiner {} destruído", describe());
                        return CompletableFuture.completedFuture(null);
                    }
                    return CompletableFuture.failedFuture(new DependencyFinalizationException(failures));
                });
    }

    @Override
    public boolean isDestroyed() {
        synchronized (lock){
            return destroyed;
        }
    }

    @Override
    public DependencyContainer merge(@NonNull DependencyContainer other) {
        DependencyContainerStorage merged = newEmptyContainer();
        mergeInto(merged, other);
        return merged;
    }

    @Override
    public List<Dependency<?>> getRegisteredDependencies() {
        synchronized (lock){
            return List.copyOf(dependencyContainer.values());
        }
    }

    @Override
    public List<Tag<?>> getRegisteredTags() {
        synchronized (lock){
            return List.copyOf(dependencyContainer.keySet());
        }
    }

    @Override
    public void enableFailureCaching() {
        this.failureCaching = true;
    }

    @Override
    public void disableFailureCaching() {
        this.failureCaching = false;
    }

    @Override
    public boolean isFailureCachingEnabled() {
        return failureCaching;
    }

    /**
     * Indica se o tag possui registro neste contêiner, sem considerar hierarquia.
     */
    protected boolean hasOwnRegistration(Tag<?> tag){
        synchronized (lock){
            return dependencyContainer.containsKey(tag);
        }
    }

    protected DependencyContainerStorage newEmptyContainer(){
        return new DependencyContainerStorage();
    }

    protected String describe(){
        return "container@" + Integer.toHexString(System.identityHashCode(this));
    }

    protected ContainerDestroyedException destroyedException(String operation){
        return new ContainerDestroyedException("Não é possível " + operation + ": contêiner " + describe() + " já foi destruído");
    }

    protected void throwIfDestroyed(String operation){
        if(isDestroyed()) throw destroyedException(operation);
    }

    protected void mergeInto(DependencyContainerStorage merged, DependencyContainer other){
        throwIfDestroyed("executar merge");
        if(other.isDestroyed()){
            throw new ContainerDestroyedException("Não é possível executar merge com um contêiner já destruído");
        }

        if(isFailureCachingEnabled()){
            merged.enableFailureCaching();
        }else{
            merged.disableFailureCaching();
        }

        for (Dependency<?> dependency : other.getRegisteredDependencies()){
            merged.registerInContainer(dependency);
        }
        for (Dependency<?> dependency : getRegisteredDependencies()){
            merged.registerInContainer(dependency);
        }
    }

    private void registerInContainer(Dependency<?> dependency){
        final Tag<?> tag = dependency.getTag();
        synchronized (lock){
            if(destroyed){
                throw destroyedException("registrar " + tag.getId());
            }
            if(instances.containsKey(tag)){
                throw new InvalidRegistrationException(
                        "A dependência " + tag.getId() + " já foi criada neste contêiner e não pode ser registrada novamente",
                        tag
                );
            }
            Dependency<?> previous = dependencyContainer.put(tag, dependency);
            if(previous != null){
                log.warn("Registro da dependência {} substituído em {}", tag.getId(), describe());
            }else{
                log.debug("Dependência {} registrada em {}", tag.getId(), describe());
            }
        }
    }

    private <T> void createInstance(Dependency<T> dependency, ResolutionChain chain, CompletableFuture<Object> creation){
        final Tag<T> tag = dependency.getTag();
        final ChainedDependencyGetter getter = new ChainedDependencyGetter(this, chain);

        log.debug("Criando dependência {} (cadeia: {})", tag.getId(), chain);

        FutureUtils.invokeSafely(() -> dependency.getFactory().create(getter))
                .whenComplete((instance, error) -> {
                    if(error == null && instance != null){
                        log.debug("Dependência {} criada em {}", tag.getId(), describe());
                        creation.complete(instance);
                        return;
                    }

                    DependencyContainerException failure = toCreationFailure(tag, error);
                    if(!failureCaching){
                        synchronized (lock){
                            instances.remove(tag, creation);
                        }
                    }
                    if(!(failure instanceof CircularDependencyException)){
                        log.error("Falha ao criar a dependência: {}", tag.getId(), failure);
                    }
                    creation.completeExceptionally(failure);
                });
    }

    private DependencyContainerException toCreationFailure(Tag<?> tag, Throwable error){
        if(error == null){
            return new DependencyCreationException(tag, "a factory devolveu null");
        }
        Throwable cause = FutureUtils.unwrap(error);
        if(cause instanceof DependencyContainerException dependencyContainerException){
            return dependencyContainerException;
        }
        return new DependencyCreationException(tag, cause);
    }

    private CompletableFuture<List<Throwable>> runFinalizers(
            Map<Tag<?>, CompletableFuture<Object>> created,
            Map<Tag<?>, Dependency<?>> registrations
    ){
        List<CompletableFuture<Void>> tasks = new ArrayList<>();

        for (Map.Entry<Tag<?>, CompletableFuture<Object>> entry : created.entrySet()){
            final Tag<?> tag = entry.getKey();
            final Dependency<Object> dependency = (Dependency<Object>) registrations.get(tag);
            if(dependency == null || !dependency.hasFinalizer()) continue;

            CompletableFuture<Void> task = entry.getValue()
                    .handle((instance, error) -> (error == null) ? instance : null)
                    .thenCompose(instance -> {
                        if(instance == null) return CompletableFuture.completedFuture(null);
                        log.debug("Executando finalizer de {}", tag.getId());
                        return FutureUtils.invokeSafely(() -> dependency.getFinalizer().destroy(instance));
                    })
                    .whenComplete((ignored, error) -> {
                        if(error != null){
                            log.error("Falha no finalizer da dependência: {}", tag.getId(), FutureUtils.unwrap(error));
                        }
                    });
            tasks.add(task);
        }

        return FutureUtils.settle(tasks);
    }

    private void logCycle(CircularDependencyException exception){
        List<Tag<?>> cycle = exception.getChain();
        StringBuilder cycleLog = new StringBuilder();
        cycleLog.append("\n╔════════════════════════════════════════════════════════════════╗\n");
        cycleLog.append("║                      ERRO CRÍTICO!                             ║\n");
        cycleLog.append("║              DEPENDÊNCIA CIRCULAR DETECTADA!                   ║\n");
        cycleLog.append("╚════════════════════════════════════════════════════════════════╝\n\n");
        cycleLog.append("  ");
        for (int i = 0; i < cycle.size(); i++) {
            cycleLog.append(cycle.get(i).getId());
            cycleLog.append("\n  │\n  ↓\n  ");
        }
        cycleLog.append(exception.getTag().getId()).append(" ⟲\n\n");

        String linearCycle = cycle.stream()
                .map(Tag::getId)
                .collect(Collectors.joining(" → "));
        cycleLog.append("  Contêiner: ").append(describe()).append('\n');
        cycleLog.append("  Caminho: ").append(linearCycle).append(" → ")
                .append(exception.getTag().getId()).append(" ⟲\n");

        log.error(cycleLog.toString());
    }

}
