package com.silverwzw.pathFS;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

import com.silverwzw.pathFS.store.MongoNodeStore;
import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.structure.TrashEntry;
import com.silverwzw.pathFS.util.Constant;
import com.silverwzw.pathFS.util.Helper;
import com.silverwzw.pathFS.util.MountOptions;
import com.silverwzw.pathFS.util.MountOptions.ParseException;

/**
 * command line entrance, runs one command against the configured store
 */
public class Shell {

	private static final Logger logger;
	public static final String commands;

	static {
		logger = Logger.getLogger(Shell.class);
		commands = "Commands:\n"
				+ "\tformat\n"
				+ "\tls [path]\n"
				+ "\tstat <path>\n"
				+ "\tmkdir <path>\n"
				+ "\tput <local file> <path>\n"
				+ "\tcat <path>\n"
				+ "\tmv <from> <to>\n"
				+ "\trm <path>\n"
				+ "\ttrash <path>\n"
				+ "\tlstrash [path]\n"
				+ "\trestore <path>\n";
	}

	private final PathFS fs;
	private final PrintStream out;

	public Shell(PathFS fs, PrintStream out) {
		this.fs = fs;
		this.out = out;
	}

	/**
	 * entrance function
	 */
	public static void main(final String... args) {
		MountOptions options;
		MongoNodeStore store;
		PathFS fs;

		logger.info("parse command line args: " + Arrays.toString(args));
		try {
			options = new MountOptions(args);
		} catch (ParseException ex) {
			System.err.print(MountOptions.usage);
			System.err.print(commands);
			logger.fatal("Parse Exception", ex);
			System.exit(2);
			return;
		} catch (IOException ex) {
			System.err.print("config file cannot be read or isn't in correct json format.\n");
			logger.fatal("I/O Exception when parsing, ", ex);
			System.exit(2);
			return;
		}
		logger.info("parsed args: " + options);

		fs = null;
		try {
			store = new MongoNodeStore(options.mongoConn());
			if (options.command()[0].equals("format")) {
				store.format();
				return;
			}
			fs = new PathFS(store, options);
			fs.setLog(null);
			new Shell(fs, System.out).run(options.command());
		} catch (IllegalArgumentException ex) {
			System.err.print(ex.getMessage() + "\n" + commands);
			System.exit(2);
		} catch (IOException ex) {
			System.err.print(ex.getMessage() + "\n");
			logger.error("command failed", ex);
			System.exit(1);
		} finally {
			if (fs != null) {
				fs.close();
			}
		}
	}

	/**
	 * @param command command name followed by its arguments
	 */
	public final void run(String... command) throws IOException {
		String op;
		op = command[0];
		if (op.equals("ls")) {
			ls(arg(command, 1, ""));
		} else if (op.equals("stat")) {
			out.println(fs.stat(arg(command, 1, null)));
		} else if (op.equals("mkdir")) {
			fs.mkdirAll(arg(command, 1, null), Constant.DEFAULT_DIR_MODE);
		} else if (op.equals("put")) {
			put(arg(command, 1, null), arg(command, 2, null));
		} else if (op.equals("cat")) {
			cat(arg(command, 1, null));
		} else if (op.equals("mv")) {
			fs.rename(arg(command, 1, null), arg(command, 2, null));
		} else if (op.equals("rm")) {
			fs.removeAll(arg(command, 1, null));
		} else if (op.equals("trash")) {
			fs.trashPath(arg(command, 1, null));
		} else if (op.equals("lstrash")) {
			for (TrashEntry entry : fs.listTrash(arg(command, 1, ""), 0)) {
				out.println(entry);
			}
		} else if (op.equals("restore")) {
			restore(arg(command, 1, null));
		} else {
			throw new IllegalArgumentException("unknown command " + op);
		}
	}

	private final static String arg(String[] command, int i, String fallback) {
		if (i < command.length) {
			return command[i];
		}
		if (fallback == null) {
			throw new IllegalArgumentException(command[0] + " : missing argument");
		}
		return fallback;
	}

	private final void ls(String path) throws IOException {
		FileHandle dir;
		dir = fs.open(path);
		try {
			List<Node> page;
			while (!(page = dir.readdir(64)).isEmpty()) {
				for (Node node : page) {
					out.println(node);
				}
			}
		} finally {
			dir.close();
		}
	}

	private final void put(String local, String path) throws IOException {
		InputStream in;
		FileHandle file;
		byte[] buf;
		int read;

		in = new FileInputStream(local);
		try {
			file = fs.create(path);
			try {
				buf = new byte[8192];
				while ((read = in.read(buf)) != Constant.EOF) {
					file.write(buf, 0, read);
				}
			} finally {
				file.close();
			}
		} finally {
			in.close();
		}
	}

	private final void cat(String path) throws IOException {
		FileHandle file;
		byte[] buf;
		int read;

		file = fs.open(path);
		try {
			buf = new byte[8192];
			while ((read = file.read(buf)) != Constant.EOF) {
				out.write(buf, 0, read);
			}
			out.flush();
		} finally {
			file.close();
		}
	}

	private final void restore(String path) throws IOException {
		path = Helper.normalize(path);
		for (TrashEntry entry : fs.listTrash(path, 0)) {
			if (entry.path().equals(path)) {
				fs.restore(entry);
				return;
			}
		}
		throw new FSException.NotExist(path);
	}
}
