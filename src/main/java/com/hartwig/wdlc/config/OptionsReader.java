package com.hartwig.wdlc.config;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

public class OptionsReader {
    private final ObjectMapper objectMapper;

    public OptionsReader() {
        objectMapper = new ObjectMapper(new YAMLFactory());
        objectMapper.registerModule(new Jdk8Module());
    }

    public CompilerOptions read(InputStream options) throws IOException {
        return objectMapper.readValue(options, CompilerOptions.class);
    }
}
