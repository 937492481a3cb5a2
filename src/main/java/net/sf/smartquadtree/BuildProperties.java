//   BuildProperties.java
//   Smart Quadtree Library
//
//  This library is free software; you can redistribute it and/or
//  modify it under the terms of the GNU Lesser General Public
//  License as published by the Free Software Foundation; either
//  version 2.1 of the License, or (at your option) any later version.
//
//  This library is distributed in the hope that it will be useful,
//  but WITHOUT ANY WARRANTY; without even the implied warranty of
//  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU
//  Lesser General Public License for more details.
//
//  You should have received a copy of the GNU Lesser General Public
//  License along with this library; if not, write to the Free Software
//  Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA

package net.sf.smartquadtree;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides the build information written into build.properties when the
 * library is packaged.
 */
public class BuildProperties {
	private static final Logger log = LoggerFactory.getLogger(BuildProperties.class);
	private static final BuildProperties instance = new BuildProperties();

	private String version = null;
	private String buildTimestamp = null;

	private BuildProperties() {
		Properties p = new Properties();
		InputStream in = BuildProperties.class.getClassLoader().getResourceAsStream("build.properties");
		if (in == null) {
			log.warn("Unable to find build.properties on the classpath");
			version = "";
			buildTimestamp = "";
			return;
		}
		try {
			p.load(in);
		} catch (IOException e) {
			log.warn("Unable to read from build.properties", e);
		} finally {
			try {
				in.close();
			} catch (IOException e) {
				log.warn("Unable to close build.properties", e);
			}
		}
		version = p.getProperty("version", "");
		buildTimestamp = p.getProperty("buildTimestamp", "");
	}

	public static String getVersion() {
		return instance.version;
	}

	public static String getBuildTimestamp() {
		return instance.buildTimestamp;
	}
}
