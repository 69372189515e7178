package com.depgraph.engine.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chooses a {@link SourceScanner} by file extension. Built-in scanners are registered first;
 * scanners found on the classpath via {@link ServiceLoader} can claim further extensions but never
 * replace one that is already claimed.
 */
public final class ScannerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScannerRegistry.class);

    private final Map<String, SourceScanner> byExtension = new ConcurrentHashMap<>();
    private final List<SourceScanner> all = Collections.synchronizedList(new ArrayList<>());

    /** Registry with the built-in scanners plus any discovered ones. */
    public static ScannerRegistry withDefaults() {
        ScannerRegistry registry = new ScannerRegistry();
        registry.register(new JavaSourceScanner());
        registry.register(PatternSourceScanner.python());
        registry.register(PatternSourceScanner.javascript());
        registry.register(PatternSourceScanner.typescript());
        registry.register(PatternSourceScanner.go());
        registry.register(PatternSourceScanner.rust());
        registry.loadViaServiceLoader();
        return registry;
    }

    public void register(SourceScanner scanner) {
        Objects.requireNonNull(scanner);
        boolean claimedAny = false;
        for (String ext : scanner.fileExtensions()) {
            SourceScanner previous = byExtension.putIfAbsent(ext.toLowerCase(), scanner);
            if (previous != null) {
                log.warn("Extension .{} already handled by the {} scanner; ignoring {}",
                        ext, previous.language(), scanner.language());
            } else {
                claimedAny = true;
            }
        }
        if (claimedAny) {
            all.add(scanner);
            log.debug("Registered {} scanner for {}", scanner.language(), scanner.fileExtensions());
        }
    }

    public Optional<SourceScanner> forPath(String path) {
        String ext = SourceInput.extensionOf(path);
        return ext.isEmpty() ? Optional.empty() : Optional.ofNullable(byExtension.get(ext));
    }

    public List<SourceScanner> all() {
        synchronized (all) {
            return List.copyOf(all);
        }
    }

    private void loadViaServiceLoader() {
        ServiceLoader<SourceScanner> loader = ServiceLoader.load(SourceScanner.class);
        for (SourceScanner scanner : loader) register(scanner);
    }
}
