package configscanner.scanners;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.google.common.base.Suppliers;

import configscanner.store.ObjectStore;

/**
 * The scanners that can be enabled by name.
 */
public class ScannerRegistry {

  @FunctionalInterface
  public interface ScannerFactory {
    FileScanner create(ScannerContext context);
  }

  private final Map<String, ScannerFactory> factories = new LinkedHashMap<>();

  /**
   * @param store only created if an object-store scanner is enabled
   * @param sink where object-store scanners send their per-branch summaries
   */
  public static ScannerRegistry defaults(Supplier<ObjectStore> store, Consumer<HarvestSummary> sink) {
    Supplier<ObjectStore> memoized = Suppliers.memoize(store::get);
    ScannerRegistry registry = new ScannerRegistry();
    registry.register(FileListScanner.NAME, FileListScanner::new);
    registry.register(ObjectStoreScanner.NAME, context -> ObjectStoreScanner.create(context, memoized.get(), sink));
    return registry;
  }

  public void register(String name, ScannerFactory factory) {
    if (factories.putIfAbsent(name, factory) != null) {
      throw new IllegalArgumentException("Scanner " + name + " is already registered");
    }
  }

  public Set<String> names() {
    return factories.keySet();
  }

  /** @throws IllegalArgumentException if any of {@code names} is not registered */
  public void checkNames(List<String> names) {
    for (String name : names) {
      if (!factories.containsKey(name)) {
        throw new IllegalArgumentException("Unknown scanner " + name + ", expected one of " + factories.keySet());
      }
    }
  }

  public List<FileScanner> create(List<String> names, ScannerContext context) {
    checkNames(names);
    List<FileScanner> scanners = new ArrayList<>();
    for (String name : names) {
      scanners.add(factories.get(name).create(context));
    }
    return scanners;
  }

}
