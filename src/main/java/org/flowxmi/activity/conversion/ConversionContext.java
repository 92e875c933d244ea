package org.flowxmi.activity.conversion;

import org.flowxmi.activity.conversion.diagnostics.Diagnostics;

/**
 * State owned by exactly one conversion: the id allocator and the diagnostics sink.
 * Every pipeline step receives the context explicitly; nothing is shared between conversions.
 */
public class ConversionContext {
    private final String diagramName;
    private final IdAllocator ids;
    private final Diagnostics diagnostics;

    public ConversionContext(String diagramName) {
        this.diagramName = diagramName == null || diagramName.isBlank() ? "Activity" : diagramName.trim();
        this.ids = new IdAllocator(this.diagramName);
        this.diagnostics = new Diagnostics();
    }

    public String diagramName() {
        return diagramName;
    }

    public IdAllocator ids() {
        return ids;
    }

    public Diagnostics diagnostics() {
        return diagnostics;
    }
}
