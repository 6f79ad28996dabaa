package dev.nodalis.backend.js;

import java.util.Locale;

/**
 * The two script hosts. Node.js loads the output as an ES module and drives
 * the scheduler itself; the embedded Jint engine has no module system and
 * calls {@code setup()} once and {@code run()} once per tick.
 */
public enum JavaScriptDialect {
    NODEJS("nodejs", true),
    JINT("jint", false);

    private final String device;
    private final boolean modules;

    JavaScriptDialect(String device, boolean modules) {
        this.device = device;
        this.modules = modules;
    }

    public String getDevice() {
        return device;
    }

    public boolean usesModules() {
        return modules;
    }

    public String logFunction() {
        return modules ? "console.log" : "log";
    }

    public String errorFunction() {
        return modules ? "console.error" : "error";
    }

    public static JavaScriptDialect forDevice(String device) {
        String id = device.trim().toLowerCase(Locale.ROOT);
        for (JavaScriptDialect dialect : values()) {
            if (dialect.device.equals(id)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("not a JavaScript device: " + device);
    }
}
