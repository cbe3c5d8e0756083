package tether.core.discovery;

import tether.core.exception.AssemblyLoadException;
import tether.core.util.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.regex.Pattern;

/**
 * Finds the binary names of the test classes in a class directory or jar.
 */
final class TestClassScanner {
    private static final Logger LOGGER = Logger.forClass(TestClassScanner.class);
    private static final String CLASS_SUFFIX = ".class";

    private TestClassScanner() {}

    /**
     * Returns the binary names of all classes in the assembly whose class file name matches the given pattern, in
     * sorted order.
     *
     * @param path The path of a class directory or jar.
     * @param testClassMatcher The pattern class file names must match.
     * @return the class names.
     * @throws AssemblyLoadException If the assembly does not exist or cannot be read.
     */
    static List<String> findTestClassNames(String path, Pattern testClassMatcher) throws AssemblyLoadException {
        File assembly = new File(path);
        if (!assembly.exists()) {
            throw new AssemblyLoadException("Assembly does not exist: " + path);
        }

        List<String> classNames = new ArrayList<>();
        try {
            if (assembly.isDirectory()) {
                fetchAllFullyQualifiedTestClassNames(testClassMatcher, assembly.getCanonicalPath().length(), assembly, classNames);
            } else {
                fetchAllTestClassNamesInJar(testClassMatcher, assembly, classNames);
            }
        } catch (IOException e) {
            throw new AssemblyLoadException("Unable to scan " + path + " for test classes", e);
        }
        Collections.sort(classNames);
        return classNames;
    }

    private static void fetchAllFullyQualifiedTestClassNames(Pattern testPattern, int baseDirLength, File currDir, List<String> classNames) throws IOException {
        File[] files = currDir.listFiles();
        if (files == null) {
            throw new IOException("Unable to list directory " + currDir);
        }
        for (File file : files) {
            if (file.isFile() && testPattern.matcher(file.getName()).matches()) {
                String fullPath = file.getCanonicalPath();
                String classPathWithBaseDirStripped = fullPath.substring(baseDirLength);
                String classNameWithSuffixStripped = classPathWithBaseDirStripped.substring(0, classPathWithBaseDirStripped.length() - CLASS_SUFFIX.length());
                String classNameBinaryFormat = classNameWithSuffixStripped.replace(File.separatorChar, '.');

                if (classNameBinaryFormat.startsWith(".")) {
                    classNameBinaryFormat = classNameBinaryFormat.substring(1);
                }

                LOGGER.log("Binary name of test class: " + classNameBinaryFormat);
                classNames.add(classNameBinaryFormat);
            } else if (file.isDirectory()) {
                fetchAllFullyQualifiedTestClassNames(testPattern, baseDirLength, file, classNames);
            }
        }
    }

    private static void fetchAllTestClassNamesInJar(Pattern testPattern, File jarFile, List<String> classNames) throws IOException {
        try (JarFile jar = new JarFile(jarFile)) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                String entryName = entries.nextElement().getName();
                String fileName = entryName.substring(entryName.lastIndexOf('/') + 1);
                if (entryName.endsWith(CLASS_SUFFIX) && testPattern.matcher(fileName).matches()) {
                    String classNameBinaryFormat = entryName.substring(0, entryName.length() - CLASS_SUFFIX.length()).replace('/', '.');
                    LOGGER.log("Binary name of test class: " + classNameBinaryFormat);
                    classNames.add(classNameBinaryFormat);
                }
            }
        }
    }
}
