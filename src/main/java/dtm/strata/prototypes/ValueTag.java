package dtm.strata.prototypes;

/**
 * Tag para valores arbitrários, como configurações ou segredos carregados por uma factory.
 *
 * @param <T> tipo do valor
 */
public final class ValueTag<T> extends Tag<T> {

    ValueTag(String id) {
        super(id);
    }

}
