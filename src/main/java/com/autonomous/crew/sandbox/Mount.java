package com.autonomous.crew.sandbox;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Bind mount or named volume; for named volumes {@code source} is the volume name. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Mount {
    private String source;
    private String target;
    private boolean readOnly;

    public String toVolumeArg() {
        return source + ":" + target + (readOnly ? ":ro" : "");
    }
}
