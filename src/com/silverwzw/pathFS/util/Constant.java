package com.silverwzw.pathFS.util;

public class Constant {
	final public static int O_RDONLY = 0;
	final public static int O_WRONLY = 01;
	final public static int O_RDWR = 02;
	final public static int O_ACCMODE = 03;
	final public static int O_CREATE = 0100;
	final public static int O_TRUNC = 01000;
	final public static int O_APPEND = 02000;
	final public static int DEFAULT_DIR_MODE = 0755;
	final public static int DEFAULT_FILE_MODE = 0644;
	final public static int EOF = -1;
}
