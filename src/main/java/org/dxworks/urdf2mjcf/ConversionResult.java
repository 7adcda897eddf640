package org.dxworks.urdf2mjcf;

import org.dxworks.urdf2mjcf.model.MjcfDocument;

public class ConversionResult {
    public final MjcfDocument document;
    public final ConversionLog log;

    public ConversionResult(MjcfDocument document, ConversionLog log) {
        this.document = document;
        this.log = log;
    }
}
