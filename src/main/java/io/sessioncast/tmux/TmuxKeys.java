package io.sessioncast.tmux;

/**
 * Maps remote key input onto literal text and tmux key names.
 */
public final class TmuxKeys {
    private TmuxKeys() {
    }

    public static boolean deliver(TmuxCapability tmux, String target, String keys, boolean enter) {
        switch (keys) {
            case "\u0003":
                return tmux.sendSpecialKey(target, "C-c");
            case "\u0004":
                return tmux.sendSpecialKey(target, "C-d");
            case "\n":
            case "\r\n":
                return tmux.sendSpecialKey(target, "Enter");
            default:
                break;
        }
        if (keys.endsWith("\n")) {
            String command = keys.substring(0, keys.length() - 1);
            if (!command.isEmpty() && !tmux.sendKeys(target, command)) {
                return false;
            }
            return tmux.sendSpecialKey(target, "Enter");
        }
        if (!tmux.sendKeys(target, keys)) {
            return false;
        }
        return !enter || tmux.sendSpecialKey(target, "Enter");
    }
}
