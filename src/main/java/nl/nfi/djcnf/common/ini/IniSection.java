package nl.nfi.djcnf.common.ini;

public final class IniSection {

    private final IniConfig iniConfig;
    private final String section;

    private IniSection(final IniConfig iniConfig, final String section) {
        this.iniConfig = iniConfig;
        this.section = section;
    }

    static IniSection ofConfig(final IniConfig iniConfig, final String section) {
        return new IniSection(iniConfig, section);
    }

    public boolean hasKey(final String key) {
        return iniConfig.hasKey(section, key);
    }

    public String getString(final String key) {
        return iniConfig.getString(section, key);
    }

    public int getInt(final String key) {
        return iniConfig.getInt(section, key);
    }

    public boolean getBoolean(final String key) {
        return iniConfig.getBoolean(section, key);
    }
}
