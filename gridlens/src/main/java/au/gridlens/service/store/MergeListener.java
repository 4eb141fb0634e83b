package au.gridlens.service.store;

/**
 * Notified after net-new records have been appended to the Raw Store.
 */
@FunctionalInterface
public interface MergeListener {
    void onMerge(MergeEvent event);
}
