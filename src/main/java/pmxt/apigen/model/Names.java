package pmxt.apigen.model;

import java.util.Objects;

public final class Names {

    private Names() {
    }

    public static String camelToTitle(String name) {
        Objects.requireNonNull(name, "name");
        final StringBuilder sb = new StringBuilder(name.length() + 8);
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                sb.append(' ');
            }
            sb.append(c);
        }
        final String spaced = sb.toString();
        if (spaced.isEmpty()) {
            return spaced;
        }
        return (Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1)).trim();
    }

    public static boolean isJavaIdentifier(String name) {
        if (name == null || name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
