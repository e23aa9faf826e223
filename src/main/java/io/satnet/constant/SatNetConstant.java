package io.satnet.constant;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class SatNetConstant {

    public static final String ETC_DIR = "/etc/satnet";
    public static final String USER_DIR_NAME = ".satnet";
    public static final String CONFIG_FILE_NAME = "config.yml";
    public static final String DEFAULT_CONFIG_RESOURCE = "satnet.default.yml";
    public static final String STORAGE_DIR_NAME = "storage";
    public static final String DEFAULT_STORAGE_FILE = "bundles.db";
}
