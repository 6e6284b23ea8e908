/**
** -----------------------------------------------------------------------------**
** CRFException.java
**
** Errors reported by camera response function estimation
**
**
** Copyright (C) 2014 Elphel, Inc.
**
** -----------------------------------------------------------------------------**
**
**  CRFException.java is free software: you can redistribute it and/or modify
**  it under the terms of the GNU General Public License as published by
**  the Free Software Foundation, either version 3 of the License, or
**  (at your option) any later version.
**
**  This program is distributed in the hope that it will be useful,
**  but WITHOUT ANY WARRANTY; without even the implied warranty of
**  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
**  GNU General Public License for more details.
**
**  You should have received a copy of the GNU General Public License
**  along with this program.  If not, see <http://www.gnu.org/licenses/>.
** -----------------------------------------------------------------------------**
**
*/

public class CRFException extends Exception {
	private static final long serialVersionUID = 4513280713391263751L;

	public enum Kind {
		INSUFFICIENT_DATA,      // empty stack or less than 2 exposures
		DIMENSION_MISMATCH,     // images of different size/number of channels
		UNSUPPORTED_BACKEND,    // no least squares solver
		CHANNEL_COUNT_MISMATCH, // model channels != image channels
		INVALID_PARAMETER
	}

	private final Kind kind;

	public CRFException(Kind kind, String message) {
		super(message);
		this.kind=kind;
	}

	public CRFException(Kind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind=kind;
	}

	public Kind getKind() {return this.kind;}

	@Override
	public String getMessage() {
		return this.kind+": "+super.getMessage();
	}
}
